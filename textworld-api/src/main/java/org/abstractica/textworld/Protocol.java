package org.abstractica.textworld;

/**
 * Message vocabulary shared by a server and its clients.
 *
 * <p>A protocol is built from two sealed interfaces whose permitted
 * subtypes are records: the messages clients may send and the messages the
 * server may send. Each record gets a stable wire name, and the shape of
 * both hierarchies is folded into a hash that peers can compare before
 * talking.</p>
 *
 * <pre>{@code
 * Protocol protocol = new JsonProtocol.Builder()
 *     .clientMessages(ClientMessage.class)
 *     .serverMessages(ServerMessage.class)
 *     .build();
 * }</pre>
 */
public interface Protocol
{
    /**
     * Fingerprint of both message hierarchies. Adding, removing or reshaping
     * a message record changes it.
     *
     * @return hex encoded hash
     */
    String getHash();

    /**
     * Builder for a {@link Protocol}.
     */
    interface Builder
    {
        /**
         * @param sealedInterface sealed interface of the client to server records
         * @return this builder
         */
        Builder clientMessages(Class<?> sealedInterface);

        /**
         * @param sealedInterface sealed interface of the server to client records
         * @return this builder
         */
        Builder serverMessages(Class<?> sealedInterface);

        /**
         * Scans both hierarchies.
         *
         * @return the protocol
         * @throws IllegalStateException    if either hierarchy was not set
         * @throws IllegalArgumentException if a hierarchy is not sealed or holds non-record types
         */
        Protocol build();
    }
}
