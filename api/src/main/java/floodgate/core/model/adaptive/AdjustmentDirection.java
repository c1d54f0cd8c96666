package floodgate.core.model.adaptive;

/**
 * Direction of a limit adjustment.
 */
public enum AdjustmentDirection {
    TIGHTEN,
    LOOSEN
}
