/**
 * Jackson-based loading of {@link io.krpc.server.core.ServerConfig} from JSON documents.
 */
package io.krpc.config.jackson;
