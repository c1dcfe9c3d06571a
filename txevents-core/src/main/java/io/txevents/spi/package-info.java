/**
 * Service provider interfaces implemented by optional modules.
 */
package io.txevents.spi;
