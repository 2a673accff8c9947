package com.marketscan.user;

import com.marketscan.entity.UserEntity;
import com.marketscan.exception.ResourceNotFoundException;
import com.marketscan.repository.jpa.UserJpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Looks up the broker credentials stored on a user row. */
@Service
public class UserCredentialService {

    private final UserJpaRepository userJpaRepository;

    public UserCredentialService(UserJpaRepository userJpaRepository) {
        this.userJpaRepository = userJpaRepository;
    }

    /**
     * @throws ResourceNotFoundException if no user has this id
     */
    @Transactional(readOnly = true)
    public BrokerCredentials getCredentials(String userId) {
        UserEntity user = userJpaRepository
                .findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        return new BrokerCredentials(
                user.getId(), user.getKiteApiKey(), user.getKiteAccessToken(), user.getInitialCapital());
    }
}
