package uy.gub.bps.towerdefense.domain.model;

public record Position(double x, double y) {
    public Position move(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    public double distanceTo(Position other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Moves towards {@code target} by at most {@code step}, never overshooting it.
     */
    public Position towards(Position target, double step) {
        double dist = distanceTo(target);
        if (dist <= step || dist < 1e-9) {
            return target;
        }
        double f = step / dist;
        return new Position(x + (target.x - x) * f, y + (target.y - y) * f);
    }

    public Position lerp(Position target, double t) {
        return new Position(x + (target.x - x) * t, y + (target.y - y) * t);
    }

    public Position nearestOnSegment(Position a, Position b) {
        double dx = b.x - a.x;
        double dy = b.y - a.y;
        double lengthSquared = dx * dx + dy * dy;
        if (lengthSquared < 1e-18) {
            return a;
        }
        double t = ((x - a.x) * dx + (y - a.y) * dy) / lengthSquared;
        t = Math.max(0, Math.min(1, t));
        return new Position(a.x + dx * t, a.y + dy * t);
    }
}
