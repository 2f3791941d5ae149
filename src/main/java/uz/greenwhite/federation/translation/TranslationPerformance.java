package uz.greenwhite.federation.translation;

import lombok.Builder;
import lombok.Value;

/**
 * Per version pair summary over the retained history.
 */
@Value
@Builder
public class TranslationPerformance {
    String versionPair;
    int samples;
    long successful;
    long failed;
    double averageDurationMs;
    long maxDurationMs;
    double averageDataSize;
}
