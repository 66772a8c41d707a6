package org.epubmeta.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cover {
    private String mediaType;
    private byte[] data;
    /** Archive path of the image */
    private String path;
}
