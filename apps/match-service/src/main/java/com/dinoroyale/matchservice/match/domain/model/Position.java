package com.dinoroyale.matchservice.match.domain.model;

/**
 * 世界坐标。y 为高度，平面（地面）距离只看 x/z。
 */
public record Position(double x, double y, double z) {

    public static final Position ORIGIN = new Position(0, 0, 0);

    /** 地面平面上的距离（忽略高度） */
    public double planarDistanceTo(Position other) {
        double dx = x - other.x;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dz * dz);
    }

    /** 线性插值，alpha ∈ [0,1] */
    public Position lerp(Position to, double alpha) {
        return new Position(
                x + (to.x - x) * alpha,
                y + (to.y - y) * alpha,
                z + (to.z - z) * alpha);
    }

    public Position withY(double newY) {
        return new Position(x, newY, z);
    }
}
