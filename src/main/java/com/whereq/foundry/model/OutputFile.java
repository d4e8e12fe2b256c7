package com.whereq.foundry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A file produced by a worker in its output directory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutputFile {
    private String name;

    /**
     * Size in bytes
     */
    private long size;

    /**
     * Extension including the dot, e.g. ".osz"; empty if none
     */
    private String type;

    private String downloadUrl;
}
