package villagecompute.autopost.services;

import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.autopost.api.types.AccountProfileType;
import villagecompute.autopost.api.types.PlatformNoteType;
import villagecompute.autopost.data.models.PublishAccount;
import villagecompute.autopost.exceptions.ResourceNotFoundException;
import villagecompute.autopost.integration.xhs.XhsPlatformClient;

/**
 * Resolves publishing accounts and their session cookies.
 */
@ApplicationScoped
public class AccountService {

    private static final Logger LOG = Logger.getLogger(AccountService.class);

    @Inject
    XhsPlatformClient platformClient;

    @Transactional
    public boolean exists(String accountId) {
        return accountId != null && PublishAccount.findById(accountId) != null;
    }

    /**
     * @return the account's session cookie
     * @throws ResourceNotFoundException
     *             if the account does not exist or has no cookie
     */
    @Transactional
    public String cookieFor(String accountId) {
        PublishAccount account = accountId == null ? null : PublishAccount.findById(accountId);
        if (account == null) {
            throw new ResourceNotFoundException("Account not found: " + accountId);
        }
        if (account.cookie == null || account.cookie.isBlank()) {
            throw new ResourceNotFoundException("Account " + accountId + " has no session cookie");
        }
        return account.cookie;
    }

    /**
     * Fetches the session's platform identity and stores user id and nickname on the account.
     */
    @Transactional
    public AccountProfileType refreshProfile(String accountId) {
        PublishAccount account = PublishAccount.findById(accountId);
        if (account == null) {
            throw new ResourceNotFoundException("Account not found: " + accountId);
        }
        AccountProfileType profile = platformClient.getSelfInfo(account.cookie);
        account.platformUserId = profile.userId();
        account.nickname = profile.nickname();
        LOG.infof("Refreshed profile for account %s (user=%s, nickname=%s)", accountId, profile.userId(),
                profile.nickname());
        return profile;
    }

    /**
     * Lists every note the account has posted.
     */
    @Transactional
    public List<PlatformNoteType> listNotes(String accountId) {
        String cookie = cookieFor(accountId);
        PublishAccount account = PublishAccount.findById(accountId);
        String userId = account.platformUserId;
        if (userId == null || userId.isBlank()) {
            userId = refreshProfile(accountId).userId();
        }
        return platformClient.getUserNotes(cookie, userId);
    }
}
