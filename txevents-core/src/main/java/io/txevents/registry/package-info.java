/**
 * Handler registration and lookup by event type.
 */
package io.txevents.registry;
