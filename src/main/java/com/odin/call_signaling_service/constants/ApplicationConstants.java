package com.odin.call_signaling_service.constants;

public class ApplicationConstants {

	public static final String API_VERSION = "/v1";
	public static final String CALLS = "/calls";
	public static final String WEBSOCKET = "/websocket";
	public static final String CUSTOMER = "/customer";
	public static final String DETAILS = "/details";

	public static final String BEARER_PREFIX = "Bearer ";
	public static final String TOKEN_QUERY_PARAM = "token";
	public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

	// Server -> client event types
	public static final String EVENT_CONNECTED = "connected";
	public static final String EVENT_PONG = "pong";
	public static final String EVENT_ERROR = "error";
	public static final String EVENT_INCOMING_CALL = "incoming-call";
	public static final String EVENT_PARTICIPANT_JOINED = "participant-joined";
	public static final String EVENT_PARTICIPANT_LEFT = "participant-left";
	public static final String EVENT_PARTICIPANT_DECLINED = "participant-declined";
	public static final String EVENT_PARTICIPANT_INVITED = "participant-invited";
	public static final String EVENT_CALL_ENDED = "call-ended";
	public static final String EVENT_CALL_MISSED = "call-missed";
	public static final String EVENT_MEDIA_STATE_UPDATE = "media-state-update";

	// Call end reasons
	public static final String REASON_USER_HANGUP = "user_hangup";
	public static final String REASON_DECLINED = "declined";
	public static final String REASON_ALL_DECLINED = "all_declined";
	public static final String REASON_ALL_LEFT = "all_left";
	public static final String REASON_NO_ANSWER = "no_answer";

	// Signaling error codes
	public static final String ERROR_INVALID_JSON = "invalid_json";
	public static final String ERROR_MISSING_FIELDS = "missing_fields";
	public static final String ERROR_INVALID_IDENTIFIER = "invalid_identifier";
	public static final String ERROR_UNKNOWN_TYPE = "unknown_type";
	public static final String ERROR_NOT_IN_CALL = "not_in_call";
	public static final String ERROR_PEER_UNREACHABLE = "peer_unreachable";
	public static final String ERROR_UNSUPPORTED_FRAME = "unsupported_frame";
	public static final String ERROR_INTERNAL = "internal_error";

	// Notification ids understood by the notification consumer
	public static final long INCOMING_CALL_NOTIFICATION_ID = 3001L;
	public static final long MISSED_CALL_NOTIFICATION_ID = 3002L;

	public static final String PROFILE_CACHE = "profileCache";

	private ApplicationConstants() {
	}
}
