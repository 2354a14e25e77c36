package in.orderflow.service.invalidation;

/**
 * What prompted an evaluation pass.
 */
public enum EvaluationReason {
    SIGNAL,     // new signals arrived
    BARS,       // bar batch without new signals
    TRADE       // after a print
}
