package com.scholary.videogen.artifact;

/**
 * Servable forms of one local media file.
 *
 * @param relativeUrl path under the media mount, e.g. {@code /media/aliyun/a.mp4}
 * @param downloadUrl download endpoint URL for the file name
 * @param absoluteUrl fully qualified media URL
 */
public record MediaUrls(String relativeUrl, String downloadUrl, String absoluteUrl) {

  public static final MediaUrls EMPTY = new MediaUrls("", "", "");
}
