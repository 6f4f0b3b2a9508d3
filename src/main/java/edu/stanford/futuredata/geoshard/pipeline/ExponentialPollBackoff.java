package edu.stanford.futuredata.geoshard.pipeline;

public class ExponentialPollBackoff implements PollBackoff {

    private final long initialDelayMillis;
    private final long maxDelayMillis;

    public ExponentialPollBackoff(long initialDelayMillis, long maxDelayMillis) {
        if (initialDelayMillis < 0 || maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException(
                    String.format("Invalid poll backoff %d..%d ms", initialDelayMillis, maxDelayMillis));
        }
        this.initialDelayMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
    }

    @Override
    public long delayMillis(int pollNumber) {
        long delay = initialDelayMillis;
        for (int i = 0; i < pollNumber && delay > 0 && delay < maxDelayMillis; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxDelayMillis);
    }
}
