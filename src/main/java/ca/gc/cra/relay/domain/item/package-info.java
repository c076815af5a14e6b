/**
 * <strong>Purpose:</strong> Payload contract shared by every pipeline stage.
 * <p><strong>Pipeline role:</strong> Domain layer; stages move {@link ca.gc.cra.relay.domain.item.Item}s between feeds.
 * <p><strong>Concurrency:</strong> Items are owned by one branch at a time; fan-out relies on
 * {@link ca.gc.cra.relay.domain.item.Item#copy()} instead of sharing.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.domain.item;
