package in.orderflow.config;

/**
 * Clamping helpers shared by the settings records.
 */
final class SettingsMath {

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.min(max, Math.max(min, value));
    }

    static double atLeast(double value, double min) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, value);
    }

    static int atLeast(int value, int min) {
        return Math.max(min, value);
    }

    private SettingsMath() {}
}
