package org.abstractica.textworld.world.server.npc;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps actor type tags to behaviours.
 *
 * <p>Unknown tags fall back to a behaviour that only counts cycles.</p>
 */
public class ActorBehaviors
{
    public static final String RHYTHM = "rhythm";
    public static final String LOREKEEPER = "lorekeeper";

    private final Map<String, ActorBehavior> byType;
    private final ActorBehavior fallback;

    public ActorBehaviors(Map<String, ActorBehavior> byType, ActorBehavior fallback)
    {
        Objects.requireNonNull(byType, "byType");
        this.byType = new HashMap<>();
        for (Map.Entry<String, ActorBehavior> entry : byType.entrySet())
        {
            this.byType.put(entry.getKey().toLowerCase(Locale.ROOT), Objects.requireNonNull(entry.getValue()));
        }
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    /**
     * The built-in set of behaviours.
     */
    public static ActorBehaviors defaults()
    {
        CountingBehavior counting = new CountingBehavior();
        Map<String, ActorBehavior> types = new HashMap<>();
        types.put(RHYTHM, new HarvestRhythmBehavior());
        for (String type : new String[]{"stability", "worker", "tending", "rotation", "economic",
                "farm", "patrol", "threshold", "machine"})
        {
            types.put(type, counting);
        }
        types.put(LOREKEEPER, new NarrativeBehavior());
        return new ActorBehaviors(types, counting);
    }

    /**
     * Returns the behaviour for a type tag.
     *
     * @param type the tag, case is ignored
     * @return the behaviour, or the fallback for unknown tags
     */
    public ActorBehavior forType(String type)
    {
        if (type == null)
        {
            return fallback;
        }
        return byType.getOrDefault(type.toLowerCase(Locale.ROOT), fallback);
    }

    public boolean isKnownType(String type)
    {
        return type != null && byType.containsKey(type.toLowerCase(Locale.ROOT));
    }
}
