package org.flowblocks.workers.lifecycle;

public enum HealthStatus {
	READY, FAILED, DRAINED
}
