package com.edgeviewer.edgeviewer.service.nativeproc;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
@Builder
public class EdgeParameters {
    private final double lowThreshold;
    private final double highThreshold;
    private final int blurRadius;
    private final boolean equalizeHistogram;

    /**
     * Gaussian kernel size for the blur radius: 0 when blurring is off, otherwise the nearest odd size.
     */
    public int blurKernelSize() {
        if (blurRadius <= 1) {
            return 0;
        }
        return blurRadius | 1;
    }
}
