package com.whereq.foundry.progress;

import lombok.Value;

/**
 * Progress read from a single line of worker output.
 */
@Value
public class ProgressUpdate {
    double progress;
    String stage;

    /**
     * True when the value comes from the stage table rather than a parsed number.
     */
    boolean estimated;
}
