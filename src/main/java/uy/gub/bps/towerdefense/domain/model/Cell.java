package uy.gub.bps.towerdefense.domain.model;

public record Cell(int x, int y) {
    public Position center() {
        return new Position(x + 0.5, y + 0.5);
    }

    public Cell offset(int dx, int dy) {
        return new Cell(x + dx, y + dy);
    }

    public static Cell containing(Position position) {
        return new Cell((int) Math.floor(position.x()), (int) Math.floor(position.y()));
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
