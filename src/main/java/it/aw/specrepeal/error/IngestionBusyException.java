package it.aw.specrepeal.error;

/** Un'altra ingestione e' in corso sullo stesso corpus. */
public class IngestionBusyException extends SpecRepealException {

    public IngestionBusyException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
