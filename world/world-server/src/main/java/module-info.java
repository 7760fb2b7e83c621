/**
 * World server module.
 *
 * <p>Runs the live world: presence, movement, room chat, actor cycles and
 * guided navigation.</p>
 */
module world.server
{
    requires textworld.api;
    requires textworld.impl;
    requires world.protocol;
    requires org.slf4j;
    requires com.fasterxml.jackson.databind;

    // Seed files are bound onto records in this package
    opens org.abstractica.textworld.world.server.seed to com.fasterxml.jackson.databind;
}
