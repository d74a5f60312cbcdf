package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Profile {

	private String customerId;

	private String firstName;

	private String lastName;

	private String mobile;

	private String email;

	private Boolean isActive;

	private Boolean isDeleted;

	/**
	 * A profile can take part in calls unless it is explicitly deactivated or deleted.
	 */
	public boolean canBeCalled() {
		return !Boolean.FALSE.equals(isActive) && !Boolean.TRUE.equals(isDeleted);
	}
}
