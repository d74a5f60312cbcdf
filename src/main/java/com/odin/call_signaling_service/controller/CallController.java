package com.odin.call_signaling_service.controller;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.ActiveCallsResponse;
import com.odin.call_signaling_service.dto.CallAnswerRequest;
import com.odin.call_signaling_service.dto.CallDeclineRequest;
import com.odin.call_signaling_service.dto.CallEndRequest;
import com.odin.call_signaling_service.dto.CallHistoryItem;
import com.odin.call_signaling_service.dto.CallHistoryResponse;
import com.odin.call_signaling_service.dto.CallInitiateRequest;
import com.odin.call_signaling_service.dto.CallInitiateResponse;
import com.odin.call_signaling_service.dto.CallInviteRequest;
import com.odin.call_signaling_service.dto.CallParticipantResponse;
import com.odin.call_signaling_service.dto.CallResponse;
import com.odin.call_signaling_service.dto.InviteResponse;
import com.odin.call_signaling_service.dto.UpdateMediaStateRequest;
import com.odin.call_signaling_service.dto.WebRTCConfig;
import com.odin.call_signaling_service.entity.Call;
import com.odin.call_signaling_service.entity.CallPage;
import com.odin.call_signaling_service.entity.CallParticipant;
import com.odin.call_signaling_service.service.CallOrchestratorService;
import com.odin.call_signaling_service.service.WebRtcConfigService;
import com.odin.call_signaling_service.utility.CallResponseMapper;
import com.odin.call_signaling_service.utility.JwtUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * REST call control. Every endpoint acts on behalf of the bearer token's subject.
 */
@Slf4j
@RestController
@RequestMapping(ApplicationConstants.API_VERSION + ApplicationConstants.CALLS)
public class CallController {

    private final CallOrchestratorService callOrchestratorService;
    private final WebRtcConfigService webRtcConfigService;
    private final CallResponseMapper callResponseMapper;
    private final JwtUtil jwtUtil;

    public CallController(CallOrchestratorService callOrchestratorService,
                          WebRtcConfigService webRtcConfigService,
                          CallResponseMapper callResponseMapper,
                          JwtUtil jwtUtil) {
        this.callOrchestratorService = callOrchestratorService;
        this.webRtcConfigService = webRtcConfigService;
        this.callResponseMapper = callResponseMapper;
        this.jwtUtil = jwtUtil;
    }

    /**
     * POST /v1/calls/initiate
     */
    @PostMapping("/initiate")
    public ResponseEntity<CallInitiateResponse> initiateCall(@RequestHeader HttpHeaders headers,
                                                             @RequestBody CallInitiateRequest request) {
        String userId = authenticate(headers);
        Call call = callOrchestratorService.initiateCall(userId, request);
        CallInitiateResponse response = CallInitiateResponse.builder()
                .message("Call initiated successfully")
                .call(callResponseMapper.toResponse(call))
                .iceServers(webRtcConfigService.getIceServers())
                .build();
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @PostMapping("/{callId}/answer")
    public ResponseEntity<CallResponse> answerCall(@RequestHeader HttpHeaders headers,
                                                   @PathVariable("callId") UUID callId,
                                                   @RequestBody(required = false) CallAnswerRequest request) {
        String userId = authenticate(headers);
        Call call = callOrchestratorService.answerCall(callId, userId, request == null ? null : request.getMetadata());
        return ResponseEntity.ok(callResponseMapper.toResponse(call));
    }

    @PostMapping("/{callId}/decline")
    public ResponseEntity<CallResponse> declineCall(@RequestHeader HttpHeaders headers,
                                                    @PathVariable("callId") UUID callId,
                                                    @RequestBody(required = false) CallDeclineRequest request) {
        String userId = authenticate(headers);
        Call call = callOrchestratorService.declineCall(callId, userId, request == null ? null : request.getReason());
        return ResponseEntity.ok(callResponseMapper.toResponse(call));
    }

    @PostMapping("/{callId}/end")
    public ResponseEntity<CallResponse> endCall(@RequestHeader HttpHeaders headers,
                                                @PathVariable("callId") UUID callId,
                                                @RequestBody(required = false) CallEndRequest request) {
        String userId = authenticate(headers);
        Call call = callOrchestratorService.endCall(callId, userId, request == null ? null : request.getReason());
        return ResponseEntity.ok(callResponseMapper.toResponse(call));
    }

    @PostMapping("/{callId}/invite")
    public ResponseEntity<InviteResponse> inviteToCall(@RequestHeader HttpHeaders headers,
                                                       @PathVariable("callId") UUID callId,
                                                       @RequestBody CallInviteRequest request) {
        String userId = authenticate(headers);
        List<CallParticipant> invited = callOrchestratorService.inviteToCall(callId, userId, request.getUserIds());
        InviteResponse response = InviteResponse.builder()
                .message("Invited " + invited.size() + " participants")
                .callId(callId)
                .invitedCount(invited.size())
                .invited(invited.stream().map(callResponseMapper::toParticipantResponse).collect(Collectors.toList()))
                .build();
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{callId}/media")
    public ResponseEntity<CallParticipantResponse> updateMediaState(@RequestHeader HttpHeaders headers,
                                                                    @PathVariable("callId") UUID callId,
                                                                    @RequestBody UpdateMediaStateRequest request) {
        String userId = authenticate(headers);
        CallParticipant participant = callOrchestratorService.updateMediaState(callId, userId, request);
        return ResponseEntity.ok(callResponseMapper.toParticipantResponse(participant));
    }

    @GetMapping("/history")
    public ResponseEntity<CallHistoryResponse> getCallHistory(@RequestHeader HttpHeaders headers,
                                                              @RequestParam(value = "limit", required = false) Integer limit,
                                                              @RequestParam(value = "offset", required = false) Integer offset) {
        String userId = authenticate(headers);
        CallPage page = callOrchestratorService.getCallHistory(userId, limit, offset);
        List<CallHistoryItem> items = page.getCalls().stream()
                .map(call -> callResponseMapper.toHistoryItem(call, userId))
                .collect(Collectors.toList());
        CallHistoryResponse response = CallHistoryResponse.builder()
                .calls(items)
                .total(page.getTotal())
                .page(page.getOffset() / page.getLimit() + 1)
                .limit(page.getLimit())
                .offset(page.getOffset())
                .hasMore(page.hasMore())
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/active")
    public ResponseEntity<ActiveCallsResponse> getActiveCalls(@RequestHeader HttpHeaders headers) {
        String userId = authenticate(headers);
        List<CallResponse> calls = callResponseMapper.toResponses(callOrchestratorService.getActiveCalls(userId));
        return ResponseEntity.ok(new ActiveCallsResponse(calls, calls.size()));
    }

    @GetMapping("/config")
    public ResponseEntity<WebRTCConfig> getWebRtcConfig(@RequestHeader HttpHeaders headers) {
        authenticate(headers);
        return ResponseEntity.ok(webRtcConfigService.getConfig());
    }

    @GetMapping("/{callId}")
    public ResponseEntity<CallResponse> getCall(@RequestHeader HttpHeaders headers,
                                                @PathVariable("callId") UUID callId) {
        String userId = authenticate(headers);
        return ResponseEntity.ok(callResponseMapper.toResponse(callOrchestratorService.getCall(callId, userId)));
    }

    private String authenticate(HttpHeaders headers) {
        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(ApplicationConstants.BEARER_PREFIX)) {
            log.warn("Missing or invalid Authorization header");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing Authorization");
        }
        String token = authHeader.substring(ApplicationConstants.BEARER_PREFIX.length()).trim();
        return jwtUtil.resolveUserId(token)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid token"));
    }
}
