/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints ({@code /api/governance}):
 * <ul>
 *   <li>{@code POST /agents/{id}/evaluate}, {@code POST /agents/{id}/recovery},
 *       {@code GET /agents/{id}/status}, {@code POST /agents/{id}/admit}</li>
 *   <li>{@code GET /agents/{id}/retraining}, {@code POST /agents/{id}/retraining/tasks},
 *       {@code POST /agents/{id}/retraining/stage}</li>
 *   <li>{@code POST /appeals}, {@code GET /appeals/{id}}, {@code POST /appeals/{id}/review}</li>
 *   <li>{@code GET /dashboard}, {@code GET /fairness}</li>
 * </ul>
 *
 * @see com.phillippitts.agentgovernor.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.agentgovernor.presentation.controller;
