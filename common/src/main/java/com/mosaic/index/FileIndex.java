package com.mosaic.index;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted listing of a catalog directory.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileIndex {

    private String type;

    /** ISO-8601 creation instant. */
    private String created;

    /** Absolute path of the indexed directory. */
    private String base;
    private List<IndexEntry> data = new ArrayList<>();
}
