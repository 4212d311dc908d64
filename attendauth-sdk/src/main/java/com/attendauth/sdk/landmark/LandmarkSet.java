package com.attendauth.sdk.landmark;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 얼굴 1개당 68점 랜드마크 (iBUG 68-point 규약).
 *
 *   0-16  턱선        (8 = chin)
 *   27-35 코          (30 = nose tip)
 *   36-41 왼쪽 눈     (36 = 바깥 눈꼬리)
 *   42-47 오른쪽 눈   (45 = 바깥 눈꼬리)
 *   48-67 입          (48 / 54 = 입꼬리)
 *
 * 생성 시 검증하지 않는다. 점 개수는 checkComplete(), 개별 인덱스 손상은 require() 에서 LandmarkException.
 */
public final class LandmarkSet {

    public static final int POINT_COUNT = 68;

    public static final int CHIN            = 8;
    public static final int NOSE_TIP        = 30;
    public static final int LEFT_EYE_START  = 36;
    public static final int RIGHT_EYE_START = 42;
    public static final int EYE_POINTS      = 6;
    public static final int LEFT_EYE_OUTER  = 36;
    public static final int RIGHT_EYE_OUTER = 45;
    public static final int MOUTH_LEFT      = 48;
    public static final int MOUTH_RIGHT     = 54;

    private final List<Point2> points;

    private LandmarkSet(List<Point2> points) {
        this.points = points;
    }

    /** null 원소를 허용해야 하므로 ImmutableList 대신 unmodifiable copy. */
    public static LandmarkSet of(List<Point2> points) {
        checkNotNull(points, "points");
        return new LandmarkSet(Collections.unmodifiableList(new ArrayList<>(points)));
    }

    public static LandmarkSet of(double[][] xy) {
        ImmutableList.Builder<Point2> b = ImmutableList.builder();
        for (double[] p : xy) b.add(new Point2(p[0], p[1]));
        return new LandmarkSet(b.build());
    }

    public int size() { return points.size(); }

    public List<Point2> points() { return points; }

    /**
     * 68점이 아니면 LandmarkException. blink / pose 경로 진입 시 호출.
     */
    public LandmarkSet checkComplete() throws LandmarkException {
        if (points.size() != POINT_COUNT) {
            throw new LandmarkException("랜드마크 개수 불일치: " + points.size() + " (필요 " + POINT_COUNT + ")");
        }
        return this;
    }

    /**
     * 필수 인덱스 점. 범위 밖 / null / NaN 이면 LandmarkException.
     */
    public Point2 require(int index) throws LandmarkException {
        if (index < 0 || index >= points.size()) {
            throw new LandmarkException("랜드마크 인덱스 없음: " + index + " (size=" + points.size() + ")");
        }
        Point2 p = points.get(index);
        if (p == null || !p.isFinite()) {
            throw new LandmarkException("랜드마크 손상: index=" + index);
        }
        return p;
    }

    /** 왼쪽 눈 6점 [36,42) */
    public Point2[] leftEye() throws LandmarkException {
        return range(LEFT_EYE_START, EYE_POINTS);
    }

    /** 오른쪽 눈 6점 [42,48) */
    public Point2[] rightEye() throws LandmarkException {
        return range(RIGHT_EYE_START, EYE_POINTS);
    }

    private Point2[] range(int start, int count) throws LandmarkException {
        Point2[] out = new Point2[count];
        for (int i = 0; i < count; i++) out[i] = require(start + i);
        return out;
    }
}
