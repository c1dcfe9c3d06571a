/**
 * Public event contracts shared between modules. A module may depend on these types but
 * never on another module's domain package.
 */
package io.txevents.demo.shared.contracts;
