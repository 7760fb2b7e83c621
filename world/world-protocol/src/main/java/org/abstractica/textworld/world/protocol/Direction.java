package org.abstractica.textworld.world.protocol;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compass directions a player can move in.
 *
 * <p>The eight horizontal directions step one room on the grid. {@link #UP}
 * and {@link #DOWN} are recognised but no room lies in them yet.</p>
 */
public enum Direction
{
    NORTH("N", "north", 0, 1),
    SOUTH("S", "south", 0, -1),
    EAST("E", "east", 1, 0),
    WEST("W", "west", -1, 0),
    NORTHEAST("NE", "northeast", 1, 1),
    NORTHWEST("NW", "northwest", -1, 1),
    SOUTHEAST("SE", "southeast", 1, -1),
    SOUTHWEST("SW", "southwest", -1, -1),
    UP("U", "up", 0, 0),
    DOWN("D", "down", 0, 0);

    /**
     * Horizontal directions in neighbour expansion order.
     *
     * <p>Route search visits neighbours in exactly this order, which decides
     * between equally short routes.</p>
     */
    public static final List<Direction> HORIZONTAL = List.of(
            NORTH, SOUTH, EAST, WEST, NORTHEAST, NORTHWEST, SOUTHEAST, SOUTHWEST);

    private final String code;
    private final String displayName;
    private final int dx;
    private final int dy;

    Direction(String code, String displayName, int dx, int dy)
    {
        this.code = code;
        this.displayName = displayName;
        this.dx = dx;
        this.dy = dy;
    }

    /**
     * Short code such as {@code "NE"}.
     */
    public String code()
    {
        return code;
    }

    /**
     * Lower case name such as {@code "northeast"}.
     */
    public String displayName()
    {
        return displayName;
    }

    public int dx()
    {
        return dx;
    }

    public int dy()
    {
        return dy;
    }

    public boolean isVertical()
    {
        return this == UP || this == DOWN;
    }

    public Direction opposite()
    {
        return switch (this)
        {
            case NORTH -> SOUTH;
            case SOUTH -> NORTH;
            case EAST -> WEST;
            case WEST -> EAST;
            case NORTHEAST -> SOUTHWEST;
            case NORTHWEST -> SOUTHEAST;
            case SOUTHEAST -> NORTHWEST;
            case SOUTHWEST -> NORTHEAST;
            case UP -> DOWN;
            case DOWN -> UP;
        };
    }

    /**
     * Where an arriving player appears to come from, as seen by those already
     * in the destination room.
     *
     * <p>A player who moves north arrives "from the south". Vertical moves
     * arrive from "below" or "above".</p>
     *
     * @return the arrival side
     */
    public String arrivalName()
    {
        if (this == UP)
        {
            return "below";
        }
        if (this == DOWN)
        {
            return "above";
        }
        return opposite().displayName;
    }

    /**
     * Parses user input such as {@code "n"}, {@code "North"} or {@code "NE"}.
     *
     * @param text the input
     * @return the direction, or empty if not recognised
     */
    public static Optional<Direction> parse(String text)
    {
        if (text == null)
        {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (Direction direction : values())
        {
            if (direction.code.toLowerCase(Locale.ROOT).equals(normalized)
                    || direction.displayName.equals(normalized))
            {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a short code as stored with portals, such as {@code "N"}.
     *
     * @param code the code
     * @return the direction
     * @throws IllegalArgumentException if the code is not a known direction
     */
    public static Direction fromCode(String code)
    {
        return parse(code).orElseThrow(() -> new IllegalArgumentException("Unknown direction: " + code));
    }
}
