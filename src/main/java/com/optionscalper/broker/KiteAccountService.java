package com.optionscalper.broker;

import com.optionscalper.broker.mapper.KitePositionMapper;
import com.optionscalper.domain.model.MarginSnapshot;
import com.optionscalper.domain.model.RawPosition;
import com.optionscalper.domain.model.UserProfile;
import com.optionscalper.exception.TransientApiException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Margin;
import com.zerodhatech.models.Profile;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Internal service for account reads against Kite: net positions, equity margins and the profile.
 * Only used by {@link KiteBrokerGateway}.
 */
@Service
@ConditionalOnProperty(name = "scalper.trading-mode", havingValue = "LIVE")
public class KiteAccountService {

    private static final Logger log = LoggerFactory.getLogger(KiteAccountService.class);

    private final KiteConnect kiteConnect;
    private final KitePositionMapper kitePositionMapper;

    public KiteAccountService(KiteConnect kiteConnect, KitePositionMapper kitePositionMapper) {
        this.kiteConnect = kiteConnect;
        this.kitePositionMapper = kitePositionMapper;
    }

    @RateLimiter(name = "kiteData")
    @Retry(name = "kiteApi")
    public List<RawPosition> getPositions() {
        try {
            return kitePositionMapper.toNetPositions(kiteConnect.getPositions());
        } catch (KiteException e) {
            log.error("Failed to fetch positions: {}", e.message);
            throw new TransientApiException("Failed to fetch positions: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching positions", e);
            throw new TransientApiException("Error fetching positions: " + e.getMessage(), e);
        }
    }

    /** Equity segment margins: available cash and utilised debits. */
    @RateLimiter(name = "kiteData")
    @Retry(name = "kiteApi")
    public MarginSnapshot getMargins() {
        try {
            Margin margin = kiteConnect.getMargins("equity");
            return MarginSnapshot.builder()
                    .available(margin.available != null ? parseBigDecimal(margin.available.cash) : BigDecimal.ZERO)
                    .utilised(margin.utilised != null ? parseBigDecimal(margin.utilised.debits) : BigDecimal.ZERO)
                    .build();
        } catch (KiteException e) {
            log.error("Failed to fetch margins: {}", e.message);
            throw new TransientApiException("Failed to fetch margins: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching margins", e);
            throw new TransientApiException("Error fetching margins: " + e.getMessage(), e);
        }
    }

    @RateLimiter(name = "kiteData")
    @Retry(name = "kiteApi")
    public UserProfile getProfile() {
        try {
            Profile profile = kiteConnect.getProfile();
            return UserProfile.builder()
                    .userId(kiteConnect.getUserId())
                    .userName(profile.userName)
                    .build();
        } catch (KiteException e) {
            log.error("Failed to fetch profile: {}", e.message);
            throw new TransientApiException("Failed to fetch profile: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching profile", e);
            throw new TransientApiException("Error fetching profile: " + e.getMessage(), e);
        }
    }

    private BigDecimal parseBigDecimal(String value) {
        if (value == null || value.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }
}
