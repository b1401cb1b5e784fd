/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters over the governance services; the exception handler maps
 * governance exceptions to HTTP status codes.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers under {@code /api/governance}</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 */
package com.phillippitts.agentgovernor.presentation;
