package com.elssolution.livestxm.domain;

import lombok.Value;

/** What the reducer emits per raw frame: scalar sum plus a display image. */
@Value
public class ReducedFrame {
    String scanId;
    long seq;
    double intensity;
    DownsampledImage image;
}
