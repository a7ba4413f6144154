/**
 * Session phase and invocation state machines.
 *
 * <p>Both machines are an enum plus a utility class holding the explicit
 * transition table. Transition methods throw {@link java.lang.IllegalStateException}
 * on any move the table does not list.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.core.statemachine;
