package in.orderflow.domain.risk;

/**
 * Result of a guardrail entry check.
 *
 * @param block   the denying block, null when allowed
 * @param changed whether guardrail state observable to the host changed during the check
 */
public record EntryDecision(boolean allowed, GuardrailBlock block, boolean changed) {

    public static EntryDecision allow(boolean changed) {
        return new EntryDecision(true, null, changed);
    }

    public static EntryDecision deny(GuardrailBlock block) {
        return new EntryDecision(false, block, true);
    }
}
