package org.gritvm.runtime;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MachineOptionsTest {

    @Test
    void fromConfig_readsMaxSteps() {
        com.typesafe.config.Config config = ConfigFactory.parseString("""
            gritvm {
              runtime {
                max-steps = 50
              }
            }
            """);

        MachineOptions options = MachineOptions.fromConfig(config);

        assertThat(options.maxSteps()).isEqualTo(50L);
        assertThat(options.isBounded()).isTrue();
    }

    @Test
    void fromConfig_withoutRuntimeBlock_usesDefaults() {
        MachineOptions options = MachineOptions.fromConfig(ConfigFactory.empty());

        assertThat(options).isEqualTo(MachineOptions.defaults());
        assertThat(options.isBounded()).isFalse();
    }

    @Test
    void fromConfig_withoutMaxSteps_isUnbounded() {
        MachineOptions options = MachineOptions.fromConfig(ConfigFactory.parseString("gritvm.runtime {}"));

        assertThat(options.maxSteps()).isEqualTo(Config.UNLIMITED_STEPS);
    }

    @Test
    void fromConfig_negativeMaxSteps_isBadValue() {
        com.typesafe.config.Config config = ConfigFactory.parseString("gritvm.runtime.max-steps = -2");

        assertThatThrownBy(() -> MachineOptions.fromConfig(config))
            .isInstanceOf(ConfigException.BadValue.class)
            .hasMessageContaining("gritvm.runtime.max-steps")
            .hasMessageContaining("-2");
    }

    @Test
    void negativeMaxSteps_isRejected() {
        assertThatThrownBy(() -> new MachineOptions(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max-steps");
    }

    @Test
    void withMaxSteps_returnsCopy() {
        MachineOptions options = MachineOptions.defaults().withMaxSteps(7);

        assertThat(options.maxSteps()).isEqualTo(7L);
        assertThat(MachineOptions.defaults().maxSteps()).isZero();
    }
}
