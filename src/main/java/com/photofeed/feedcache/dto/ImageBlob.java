package com.photofeed.feedcache.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 图片字节与 MIME
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageBlob {

    private String mime;

    @ToString.Exclude
    private byte[] data;
}
