package com.mosaic.index;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One file or directory record of a {@link FileIndex}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexEntry {

    public static final String FILE = "f";
    public static final String DIRECTORY = "d";

    /** Path relative to the index base, using {@code /} as separator. */
    private String filename;
    private long size;
    private long ino;
    private long mtimeMs;
    private String sha1sum;

    /** {@link #FILE} or {@link #DIRECTORY}. */
    private String fileType;

    @JsonIgnore
    public boolean isFile() {
        return FILE.equals(fileType);
    }

    /** Parent directory of {@link #filename}, empty for top-level records. */
    public String directory() {
        if (filename == null) {
            return "";
        }
        int slash = filename.lastIndexOf('/');
        return slash < 0 ? "" : filename.substring(0, slash);
    }
}
