package com.odin.call_signaling_service.utility;

import java.util.List;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.ResponseDTO;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class Utility {

	private final ObjectMapper objectMapper;
	private final RestTemplate restTemplate;

	public <E> E getAnInstance(Object data, Class<E> entityClass) {
		if (data == null) {
			return null;
		}
		try {
			if (data instanceof List<?>) {
				List<?> dataList = (List<?>) data;
				return dataList.isEmpty() ? null : objectMapper.convertValue(dataList.get(0), entityClass);
			}
			return objectMapper.convertValue(data, entityClass);
		} catch (IllegalArgumentException e) {
			log.error("Error occured while converting to class {} : {}", entityClass.getSimpleName(),
					ExceptionUtils.getStackTrace(e));
			return null;
		}
	}

	/**
	 * POSTs/GETs to another service, propagating the current correlation id.
	 *
	 * @throws IllegalStateException when the call fails or returns a non-2xx status
	 */
	public <T> ResponseDTO makeRestCall(String url, T requestBody, HttpMethod httpMethod) {
		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_JSON);
		headers.set(ApplicationConstants.CORRELATION_ID_HEADER, CorrelationIdUtil.getOrCreate());
		HttpEntity<T> entity = new HttpEntity<>(requestBody, headers);

		ResponseEntity<ResponseDTO> response;
		try {
			response = restTemplate.exchange(url, httpMethod, entity, ResponseDTO.class);
		} catch (RestClientException e) {
			throw new IllegalStateException("Error while making REST call to " + url, e);
		}
		if (!response.getStatusCode().is2xxSuccessful()) {
			throw new IllegalStateException("Failed with HTTP error code : " + response.getStatusCode());
		}
		return response.getBody();
	}
}
