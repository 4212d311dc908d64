package com.attendauth.sdk.landmark;

import static com.google.common.base.Preconditions.checkArgument;

/** 프레임 크기 (px). 카메라 intrinsics 근사에 사용. */
public final class FrameSize {
    public final int width;
    public final int height;

    public FrameSize(int width, int height) {
        checkArgument(width > 0 && height > 0, "frame size must be positive: %sx%s", width, height);
        this.width = width;
        this.height = height;
    }

    public double centerX() { return width / 2.0; }

    public double centerY() { return height / 2.0; }

    @Override public String toString() {
        return width + "x" + height;
    }
}
