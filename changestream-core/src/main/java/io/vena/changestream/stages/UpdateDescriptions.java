package io.vena.changestream.stages;

import io.vena.changestream.UpdateDescription;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonValue;

/**
 * Turns the <code>o</code> field of an update oplog entry into an {@link UpdateDescription}.
 *
 * <p>
 * Two formats exist. Classic modifier documents look like
 * <code>{$set: {...}, $unset: {...}}</code>. Servers from 5.0 on write
 * delta documents: <code>{$v: 2, diff: {u: {...}, i: {...}, d: {...}, s&lt;field&gt;: {...}}}</code>,
 * where the <code>s</code> entries are nested diffs of subdocuments or arrays.
 */
final class UpdateDescriptions {
	private UpdateDescriptions() { }

	static final String SET = "$set";
	static final String UNSET = "$unset";
	static final String VERSION = "$v";
	static final String DIFF = "diff";
	static final int DELTA_VERSION = 2;

	static boolean isModifierDocument(BsonDocument o) {
		return o.keySet().stream().anyMatch(k -> k.startsWith("$"));
	}

	static UpdateDescription fromModifiers(BsonDocument o) {
		BsonDocument updated = new BsonDocument();
		List<String> removed = new ArrayList<>();
		if (isDelta(o)) {
			readDiff(o.getDocument(DIFF), "", updated, removed);
		} else {
			BsonValue set = o.get(SET);
			if (set != null && set.isDocument()) {
				updated.putAll(set.asDocument());
			}
			BsonValue unset = o.get(UNSET);
			if (unset != null && unset.isDocument()) {
				removed.addAll(unset.asDocument().keySet());
			}
		}
		return new UpdateDescription(updated.clone(), removed);
	}

	private static boolean isDelta(BsonDocument o) {
		BsonValue version = o.get(VERSION);
		return version != null
			&& version.isNumber()
			&& version.asNumber().intValue() == DELTA_VERSION
			&& o.isDocument(DIFF);
	}

	private static void readDiff(BsonDocument diff, String prefix, BsonDocument updated, List<String> removed) {
		for (Map.Entry<String, BsonValue> section: diff.entrySet()) {
			String key = section.getKey();
			BsonValue value = section.getValue();
			switch (key) {
				case "u", "i" -> value.asDocument().forEach((field, v) -> updated.append(prefix + field, v));
				case "d" -> value.asDocument().keySet().forEach(field -> removed.add(prefix + field));
				default -> {
					if (key.startsWith("s") && value.isDocument()) {
						readSubDiff(value.asDocument(), prefix + key.substring(1) + ".", updated, removed);
					}
				}
			}
		}
	}

	private static void readSubDiff(BsonDocument subDiff, String prefix, BsonDocument updated, List<String> removed) {
		if (subDiff.getBoolean("a", BsonBoolean.FALSE).getValue()) {
			readArrayDiff(subDiff, prefix, updated, removed);
		} else {
			readDiff(subDiff, prefix, updated, removed);
		}
	}

	private static void readArrayDiff(BsonDocument arrayDiff, String prefix, BsonDocument updated, List<String> removed) {
		for (Map.Entry<String, BsonValue> entry: arrayDiff.entrySet()) {
			String key = entry.getKey();
			if (key.length() < 2) {
				// "a" marker and "l" new length
				continue;
			}
			String index = key.substring(1);
			if (key.startsWith("u")) {
				updated.append(prefix + index, entry.getValue());
			} else if (key.startsWith("s") && entry.getValue().isDocument()) {
				readSubDiff(entry.getValue().asDocument(), prefix + index + ".", updated, removed);
			}
		}
	}
}
