/**
 * Text world library API module.
 *
 * <p>Provides the interfaces for building line-oriented game servers with
 * typed messages over TCP connections.</p>
 */
module textworld.api
{
    exports org.abstractica.textworld;
    exports org.abstractica.textworld.handlers;
}
