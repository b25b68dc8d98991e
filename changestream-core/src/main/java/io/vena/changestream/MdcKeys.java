package io.vena.changestream;

final class MdcKeys {
	static final String STREAM_NAME = "changeStream.name";
	static final String EVENT       = "changeStream.event";
}
