/**
 * Envelope model and JSON codecs.
 *
 * <p>{@link com.ryuqq.icnp.core.message.EnvelopeCodec} performs the structural checks of
 * every inbound message. {@link com.ryuqq.icnp.core.message.PayloadCodec} maps payloads to
 * the domain model and back. Its output is also the input of binding hashes and signatures.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.message;
