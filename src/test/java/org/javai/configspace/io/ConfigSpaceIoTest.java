package org.javai.configspace.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.javai.configspace.model.Condition;
import org.javai.configspace.model.ConfigurationSpace;
import org.javai.configspace.model.Hyperparameter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigSpaceIo")
class ConfigSpaceIoTest {

	private final ConfigSpaceIo io = ConfigSpaceIo.withDefaults();

	private static final String PCS = """
			kernel categorical {rbf, poly} [rbf]
			degree integer [2, 5] [3]

			degree | kernel == poly
			""";

	@Test
	@DisplayName("reads text with any line terminator")
	void readsText() {
		ConfigurationSpace space = io.read("pcs_new", PCS.replace("\n", "\r\n"));

		assertThat(space.hyperparameterNames()).containsExactly("kernel", "degree");
		assertThat(space.conditionFor("degree")).contains(new Condition.Equals("degree", "kernel", "poly"));
	}

	@Test
	@DisplayName("reads from a reader")
	void readsReader() {
		assertThat(io.read("pcs_new", new StringReader(PCS)).size()).isEqualTo(2);
	}

	@Test
	@DisplayName("converts between formats through files")
	void convertsThroughFiles(@TempDir Path dir) throws Exception {
		Path pcs = dir.resolve("space.pcs");
		Files.writeString(pcs, PCS);
		Path irace = dir.resolve("parameters.txt");

		io.write("irace", io.read("pcs_new", pcs), irace);

		assertThat(Files.readString(irace)).isEqualTo("""
				kernel '--kernel ' c (rbf,poly)
				degree '--degree ' i (2, 5) | kernel %in% c(poly)
				""");
		assertThat(io.read("irace", irace).getHyperparameter("degree"))
				.isEqualTo(Hyperparameter.Continuous.integer("degree", 2, 5, 4));
	}

	@Test
	@DisplayName("writes with the configured line separator")
	void configuredLineSeparator() {
		ConfigSpaceIo windows = new ConfigSpaceIo(ConfigSpaceFormats.withDefaults(
				ConfigSpaceIoConfig.builder().lineSeparator("\r\n").build()));
		ConfigurationSpace space = new ConfigurationSpace();
		space.addHyperparameter(Hyperparameter.Categorical.of("a", List.of("x", "y")));
		space.addHyperparameter(new Hyperparameter.Constant("b", "1"));

		assertThat(windows.write("pcs_new", space)).isEqualTo("a categorical {x, y} [x]\r\nb {1} [1]\r\n");
	}

	@Test
	@DisplayName("unknown format ids are rejected")
	void unknownFormat() {
		assertThatThrownBy(() -> io.read("json", PCS)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> io.write("json", new ConfigurationSpace())).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("I/O failures surface as UncheckedIOException")
	void ioFailures(@TempDir Path dir) {
		assertThatThrownBy(() -> io.read("pcs_new", dir.resolve("missing.pcs")))
				.isInstanceOf(UncheckedIOException.class)
				.hasMessageContaining("missing.pcs");
		assertThatThrownBy(() -> io.write("pcs_new", new ConfigurationSpace(), dir.resolve("no-such-dir/out.pcs")))
				.isInstanceOf(UncheckedIOException.class);
	}
}
