/**
 * Protocol value objects shared by every ICNP component.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.icnp.core.model.SessionId} - Negotiation session identifier</li>
 *   <li>{@link com.ryuqq.icnp.core.model.MessageId} - Envelope identifier used for de-duplication and causality</li>
 * </ul>
 *
 * <h2>Participants and Attestations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.icnp.core.model.Actor} - Sender, recipient, party or audience member</li>
 *   <li>{@link com.ryuqq.icnp.core.model.Signature} - Contract or token signature</li>
 *   <li>{@link com.ryuqq.icnp.core.model.HashValue} - Binding hash with algorithm name</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.model;
