package com.myorg.changefeed.contracts.lock;

/**
 * @param incidentDetected this caller burned a stuck holder on the way in
 * @param incidentCount    incident count of the shard as last observed
 * @param attempts         lock attempts made, at least 1
 */
public record LockResult(boolean incidentDetected, long incidentCount, int attempts) {}
