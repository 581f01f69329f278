package com.echelon.controlplane.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.echelon.kernel.registry.PackRegistry;
import com.echelon.packs.settings.InMemorySettingsRepository;
import com.echelon.packs.settings.SettingsPack;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@DisplayName("KernelConfiguration")
@ExtendWith(OutputCaptureExtension.class)
class KernelConfigurationTest {

    @Test
    @DisplayName("pack registry bean reports its build exactly once")
    void registryLoggedOnce(CapturedOutput output) {
        PackRegistry registry = new KernelConfiguration()
                .packRegistry(List.of(new SettingsPack(new InMemorySettingsRepository())));

        assertThat(registry.lookup("settings.get")).isPresent();
        assertThat(output.getOut().split("Pack registry built", -1)).hasSize(2);
    }
}
