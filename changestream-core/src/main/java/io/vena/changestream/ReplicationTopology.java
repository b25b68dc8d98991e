package io.vena.changestream;

import org.bson.BsonTimestamp;

/**
 * The replica set the oplog belongs to.
 * Change streams can't be opened without one.
 */
public interface ReplicationTopology {
	/**
	 * A new stream with no resume position begins with entries strictly after this time.
	 */
	BsonTimestamp lastAppliedOpTime();
}
