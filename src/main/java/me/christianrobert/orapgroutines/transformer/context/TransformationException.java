package me.christianrobert.orapgroutines.transformer.context;

/**
 * Exception thrown when a routine cannot be translated (unsupported construct,
 * malformed source). Carries the offending source fragment and where it happened.
 *
 * <p>Callers translating many routines catch it per routine and record a failed
 * result, so a single bad routine never aborts the package or the run.
 */
public class TransformationException extends RuntimeException {

    private final String oracleSql;
    private final String context;

    public TransformationException(String message) {
        super(message);
        this.oracleSql = null;
        this.context = null;
    }

    public TransformationException(String message, Throwable cause) {
        super(message, cause);
        this.oracleSql = null;
        this.context = null;
    }

    public TransformationException(String message, String oracleSql, String context) {
        super(message);
        this.oracleSql = oracleSql;
        this.context = context;
    }

    public String getOracleSql() {
        return oracleSql;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including Oracle SQL and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (oracleSql != null) {
            sb.append("\nOracle SQL: ").append(oracleSql);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
