/**
 * Routing policies.
 *
 * <p>Every policy maps {@code (request, candidates, stats)} to a
 * {@link fr.lapetina.llmgateway.domain.model.RoutingDecision}: the full
 * candidate list in dispatch order plus a reason derived from the metric
 * that decided the ranking.
 *
 * <h2>Available Policies</h2>
 * <ul>
 *   <li>{@code priority} - configured priority, ties in insertion order</li>
 *   <li>{@code speed} - average latency over the stats window</li>
 *   <li>{@code cost} - configured token prices</li>
 *   <li>{@code smart} - weighted composite of latency, error rate, price and priority</li>
 * </ul>
 *
 * <p>{@code speed} and {@code smart} degrade to the priority ranking until
 * statistics exist.
 */
package fr.lapetina.llmgateway.domain.strategy;
