package com.ayende.backend.service;

import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Reward;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.enums.RewardStatus;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RewardServiceTest extends BaseSpringTest {

    @Autowired RewardService rewardService;
    @Autowired RedemptionService redemptionService;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        tenant = newBusiness("catalog").tenant();
    }

    @Test
    void unredeemed_reward_is_deleted() {
        Reward reward = newReward(tenant, "Window sticker", 10, null, 0);

        assertThat(rewardService.delete(tenant.getId(), reward.getId())).isTrue();

        assertThat(rewardRepository.findById(reward.getId())).isEmpty();
    }

    @Test
    void redeemed_reward_is_deactivated_instead() {
        Membership member = newMember(tenant, 100);
        Reward reward = newReward(tenant, "Free coffee", 60, null, 0);
        assertThat(redemptionService.redeem(tenant.getId(), member.getId(), reward.getId(), null).isOk()).isTrue();

        assertThat(rewardService.delete(tenant.getId(), reward.getId())).isFalse();

        Reward after = rewardRepository.findById(reward.getId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(RewardStatus.INACTIVE);
        assertThat(after.getRedeemedCount()).isEqualTo(1);
    }

    @Test
    void reward_of_another_business_cannot_be_deleted() {
        Tenant other = newBusiness("catalog-other").tenant();
        Reward reward = newReward(other, "Tote bag", 10, null, 0);

        assertThatThrownBy(() -> rewardService.delete(tenant.getId(), reward.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(rewardRepository.findById(reward.getId())).isPresent();
    }
}
