package com.mosaic.blender;

public enum BlendPolicy {
    /** alpha * new + (1 - alpha) * old, alpha taken from the new image's own alpha channel. */
    LEGACY,
    /** Where both images have content, mix * new + (1 - mix) * old; otherwise whichever has content. */
    WEIGHTED_OVERLAP
}
