package org.javai.configspace.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.configspace.io.irace.IraceFormat;
import org.javai.configspace.io.pcs.PcsFormat;
import org.javai.configspace.model.ConfigurationSpace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigSpaceFormats")
class ConfigSpaceFormatsTest {

	@Test
	@DisplayName("withDefaults registers both built-in formats in order")
	void defaults() {
		ConfigSpaceFormats formats = ConfigSpaceFormats.withDefaults(ConfigSpaceIoConfig.defaults());

		assertThat(formats.formats()).extracting(ConfigSpaceFormat::id).containsExactly("irace", "pcs_new");
		assertThat(formats.require("irace")).isInstanceOf(IraceFormat.class);
		assertThat(formats.formatFor("pcs_new")).containsInstanceOf(PcsFormat.class);
	}

	@Test
	@DisplayName("the first registration for an id wins")
	void firstRegistrationWins() {
		PcsFormat first = new PcsFormat();
		ConfigSpaceFormats formats = ConfigSpaceFormats.create()
				.register(first)
				.register(new PcsFormat());

		assertThat(formats.formats()).hasSize(1);
		assertThat(formats.require(PcsFormat.ID)).isSameAs(first);
	}

	@Test
	@DisplayName("unknown ids are empty or rejected")
	void unknownIds() {
		ConfigSpaceFormats formats = ConfigSpaceFormats.create();

		assertThat(formats.formatFor("pcs")).isEmpty();
		assertThatThrownBy(() -> formats.require("pcs"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'pcs'");
	}

	@Test
	@DisplayName("a format without an id cannot be registered")
	void rejectsBlankId() {
		ConfigSpaceFormat anonymous = new ConfigSpaceFormat() {
			@Override
			public String id() {
				return " ";
			}

			@Override
			public ConfigurationSpace read(List<String> lines) {
				return new ConfigurationSpace();
			}

			@Override
			public String write(ConfigurationSpace space) {
				return "";
			}
		};

		assertThatThrownBy(() -> ConfigSpaceFormats.create().register(anonymous))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
