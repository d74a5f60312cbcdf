package com.odin.call_signaling_service.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.Profile;
import com.odin.call_signaling_service.repo.ProfileRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cached view of the user directory. Only found profiles are cached; directory
 * failures propagate to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

	private final ProfileRepository profileRepository;
	private final CacheManager cacheManager;

	public Profile getOrLoadProfile(String userId) {
		if (userId == null) {
			return null;
		}
		Cache cache = cacheManager.getCache(ApplicationConstants.PROFILE_CACHE);
		if (cache != null) {
			Profile cached = cache.get(userId, Profile.class);
			if (cached != null) {
				return cached;
			}
		}

		log.debug("Loading profile for userId={} from core service", userId);
		Profile profile = profileRepository.findByCustomerId(userId);
		if (profile != null && cache != null) {
			cache.put(userId, profile);
		}
		return profile;
	}

	public boolean isActiveUser(String userId) {
		Profile profile = getOrLoadProfile(userId);
		return profile != null && profile.canBeCalled();
	}

	/**
	 * @return the ids that do not resolve to an active user, in input order
	 */
	public List<String> findUnavailable(Collection<String> userIds) {
		List<String> unavailable = new ArrayList<>();
		for (String userId : userIds) {
			if (!isActiveUser(userId)) {
				unavailable.add(userId);
			}
		}
		return unavailable;
	}
}
