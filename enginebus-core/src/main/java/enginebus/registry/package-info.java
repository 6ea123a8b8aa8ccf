/**
 * Handler routing tables keyed by message type and session scope.
 */
package enginebus.registry;
