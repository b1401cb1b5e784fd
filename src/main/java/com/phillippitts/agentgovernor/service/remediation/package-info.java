/**
 * Mandatory retraining for level 5 and 6 penalties.
 */
package com.phillippitts.agentgovernor.service.remediation;
