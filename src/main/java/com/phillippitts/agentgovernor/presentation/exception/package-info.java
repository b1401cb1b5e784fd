/**
 * Translation of governance exceptions into {@code ApiError} responses.
 */
package com.phillippitts.agentgovernor.presentation.exception;
