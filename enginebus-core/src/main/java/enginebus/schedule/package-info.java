/**
 * Delayed delivery: {@link enginebus.schedule.EventScheduler} keeps scheduled events in a
 * time-ordered queue and merges them into the dispatch queue once due.
 */
package enginebus.schedule;
