package org.abstractica.textworld.world.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Player-facing text templates.
 *
 * <p>Templates are {@link MessageFormat} patterns loaded from a properties
 * resource. Arguments are passed through {@link String#valueOf(Object)} first
 * so numbers are never locale formatted.</p>
 */
public class GameMessages
{
    private static final Logger LOG = LoggerFactory.getLogger(GameMessages.class);

    public static final String DEFAULT_RESOURCE = "messages.properties";

    private final Properties templates;

    public GameMessages(Properties templates)
    {
        this.templates = new Properties();
        this.templates.putAll(Objects.requireNonNull(templates, "templates"));
    }

    /**
     * Loads the bundled templates.
     *
     * @return the messages
     * @throws IllegalStateException if the resource is missing
     */
    public static GameMessages loadDefault()
    {
        try (InputStream in = GameMessages.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE))
        {
            if (in == null)
            {
                throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8))
            {
                properties.load(reader);
            }
            return new GameMessages(properties);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Formats a template.
     *
     * <p>An unknown key yields the key itself and logs a warning.</p>
     *
     * @param key  template key
     * @param args template arguments
     * @return the text
     */
    public String format(String key, Object... args)
    {
        String template = templates.getProperty(key);
        if (template == null)
        {
            LOG.warn("Missing message template: {}", key);
            return key;
        }
        Object[] text = new Object[args.length];
        for (int i = 0; i < args.length; i++)
        {
            text[i] = String.valueOf(args[i]);
        }
        return new MessageFormat(template, Locale.ROOT).format(text);
    }
}
