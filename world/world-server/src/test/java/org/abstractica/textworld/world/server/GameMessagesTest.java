package org.abstractica.textworld.world.server;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GameMessages}.
 */
class GameMessagesTest
{
    private final GameMessages messages = GameMessages.loadDefault();

    @Test
    void format_fillsArguments()
    {
        assertEquals("<Fliz> enters from the southwest.", messages.format("player.entersFrom", "Fliz", "southwest"));
        assertEquals("!Ouch! You walked into the wall to the west.!", messages.format("move.wall", "west"));
    }

    @Test
    void format_keepsLiteralQuotes()
    {
        assertEquals("You don't see \"rune\" here.", messages.format("look.notHere", "rune"));
    }

    @Test
    void format_numbersAreNotGrouped()
    {
        assertEquals("<Tree> pulses 12000 Resin for harvest.", messages.format("harvest.pulse", "Tree", 12000, "Resin"));
    }

    @Test
    void format_unknownKey_returnsKey()
    {
        assertEquals("no.such.key", messages.format("no.such.key", "x"));
    }

    @Test
    void constructor_copiesTemplates()
    {
        Properties templates = new Properties();
        templates.setProperty("greet", "Hello {0}");
        GameMessages custom = new GameMessages(templates);
        templates.setProperty("greet", "Bye {0}");

        assertEquals("Hello Ann", custom.format("greet", "Ann"));
    }
}
