package eu.virtualparadox.docingest.ingest.exception;

import java.util.Locale;

public class SizeLimitExceededException extends DocumentIngestException {

    private final int limitMb;

    public SizeLimitExceededException(final FileContext context, final int limitMb) {
        super(String.format(Locale.ROOT, "File size %.2fMB exceeds limit of %dMB", context.sizeMb(), limitMb),
                context, null);
        this.limitMb = limitMb;
    }

    public int getLimitMb() {
        return limitMb;
    }
}
