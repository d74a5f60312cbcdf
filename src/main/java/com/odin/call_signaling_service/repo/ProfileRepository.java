package com.odin.call_signaling_service.repo;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.Profile;
import com.odin.call_signaling_service.dto.ResponseDTO;
import com.odin.call_signaling_service.utility.SearchCriteria;
import com.odin.call_signaling_service.utility.Utility;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads user profiles from the core service. This service owns no user data.
 */
@Slf4j
@Component
public class ProfileRepository {

	private final Utility utility;
	private final String coreUpdateUrl;

	public ProfileRepository(Utility utility, @Value("${core.update.url}") String coreUpdateUrl) {
		this.utility = utility;
		this.coreUpdateUrl = coreUpdateUrl;
	}

	public Profile findByCustomerId(String id) {
		List<SearchCriteria> searchCriteriaList = new ArrayList<>();
		searchCriteriaList.add(new SearchCriteria("customerId", ":", id, ""));

		ResponseDTO response = utility.makeRestCall(
				coreUpdateUrl + ApplicationConstants.CUSTOMER + ApplicationConstants.DETAILS, searchCriteriaList,
				HttpMethod.POST);
		if (response == null) {
			log.warn("Empty response from core service for customerId={}", id);
			return null;
		}
		return utility.getAnInstance(response.getData(), Profile.class);
	}
}
