/**
 * World protocol module.
 *
 * <p>Message records shared by the world server and its clients.</p>
 */
module world.protocol
{
    exports org.abstractica.textworld.world.protocol;

    // Messages are written and read by Jackson
    opens org.abstractica.textworld.world.protocol to com.fasterxml.jackson.databind;
}
