package com.echelon.controlplane.config;

import com.echelon.packs.iam.IamPack;
import com.echelon.packs.iam.InMemoryTeamMemberRepository;
import com.echelon.packs.iam.TeamMemberRepository;
import com.echelon.packs.settings.InMemorySettingsRepository;
import com.echelon.packs.settings.SettingsPack;
import com.echelon.packs.settings.SettingsRepository;
import com.echelon.packs.webhooks.InMemoryWebhookRepository;
import com.echelon.packs.webhooks.WebhookRepository;
import com.echelon.packs.webhooks.WebhooksPack;
import com.echelon.security.CredentialRepository;
import com.echelon.security.SecretHasher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The built-in packs. Every {@link com.echelon.kernel.registry.Pack} bean in the context is
 * registered with the kernel, so additional packs only need to be declared as beans.
 */
@Configuration
public class PackConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TeamMemberRepository teamMemberRepository() {
        return new InMemoryTeamMemberRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookRepository webhookRepository() {
        return new InMemoryWebhookRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public SettingsRepository settingsRepository() {
        return new InMemorySettingsRepository();
    }

    @Bean
    public IamPack iamPack(CredentialRepository credentials, TeamMemberRepository team, SecretHasher hasher) {
        return new IamPack(credentials, team, hasher);
    }

    @Bean
    public WebhooksPack webhooksPack(WebhookRepository webhooks) {
        return new WebhooksPack(webhooks);
    }

    @Bean
    public SettingsPack settingsPack(SettingsRepository settings) {
        return new SettingsPack(settings);
    }
}
