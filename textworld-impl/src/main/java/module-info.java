/**
 * Text world library implementation module.
 *
 * <p>Provides the default socket server and the JSON line protocol.</p>
 */
module textworld.impl
{
    requires textworld.api;
    requires org.slf4j;
    requires com.fasterxml.jackson.databind;

    // Export the server factory for external use
    exports org.abstractica.textworld.impl.session;

    // Export the protocol builder for message registration
    exports org.abstractica.textworld.impl.protocol;
}
