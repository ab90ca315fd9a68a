package org.javai.dygram.validate;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.dygram.build.CompilationResult;
import org.javai.dygram.build.MachineCompiler;
import org.javai.dygram.config.DygramConfig;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.diagnostics.Severity;
import org.javai.dygram.model.Machine;
import org.junit.jupiter.api.Test;

class MachineValidatorTest {

	@Test
	void threeCycleIsAWarningNamingItsMembersInOrder() {
		Machine machine = compile("""
				init start;
				state a; state b; state c;
				start -> a;
				a -> b -> c -> a;
				""");

		List<Diagnostic> cycles = codes(new MachineValidator().validate(machine), "CYCLE_DETECTED");

		assertThat(cycles).singleElement().satisfies(cycle -> {
			assertThat(cycle.severity()).isEqualTo(Severity.WARNING);
			assertThat(cycle.message()).isEqualTo("Cycle detected: a -> b -> c -> a");
			assertThat(cycle.related()).containsExactly("a", "b", "c", "a");
		});
	}

	@Test
	void cycleSeverityIsConfigurable() {
		Machine machine = compile("init start; state a; state b; start -> a; a -> b -> a;");
		ValidationOptions options = ValidationOptions.builder().cycleSeverity(Severity.ERROR).build();

		ValidationReport report = new MachineValidator(options).validate(machine);

		assertThat(report.hasErrors()).isTrue();
		assertThat(codes(report, "CYCLE_DETECTED")).allMatch(Diagnostic::isError);
	}

	@Test
	void reportsUnreachableAndOrphanNodesAsWarnings() {
		Machine machine = compile("""
				init start;
				task a; task b; task lonely;
				start -> a;
				b -> a;
				""");

		ValidationReport report = new MachineValidator().validate(machine);

		assertThat(codes(report, "UNREACHABLE_NODE")).extracting(Diagnostic::nodePath).containsExactly("b", "lonely");
		assertThat(codes(report, "ORPHAN_NODE")).extracting(Diagnostic::nodePath).containsExactly("lonely");
		assertThat(report.hasErrors()).isFalse();
	}

	@Test
	void contextNodesAreNeitherUnreachableNorOrphans() {
		Machine machine = compile("""
				init start;
				task a;
				context settings { limit: 3; }
				start -> a;
				""");

		ValidationReport report = new MachineValidator().validate(machine);

		assertThat(codes(report, "UNREACHABLE_NODE")).isEmpty();
		assertThat(codes(report, "ORPHAN_NODE")).isEmpty();
	}

	@Test
	void disabledChecksReportNothing() {
		Machine machine = compile("init start; task a; task lonely; start -> a; a -> start;");
		ValidationOptions options = ValidationOptions.builder()
				.checkUnreachable(false)
				.checkOrphans(false)
				.checkCycles(false)
				.build();

		ValidationReport report = new MachineValidator(options).validate(machine);

		assertThat(report.diagnostics()).isEmpty();
	}

	@Test
	void warnsAboutMissingEntryPointAndInitWithoutTransitions() {
		assertThat(codes(new MachineValidator().validate(compile("task a; task b; a -> b;")), "MISSING_ENTRY_POINT"))
				.hasSize(1);
		assertThat(codes(new MachineValidator().validate(compile("init start;")), "INIT_WITHOUT_TRANSITIONS"))
				.singleElement()
				.satisfies(d -> assertThat(d.kind()).isEqualTo(DiagnosticKind.SEMANTIC_VIOLATION));
	}

	@Test
	void checksAnnotationCompatibility() {
		Machine machine = compile("""
				init start @Abstract;
				state waiting @Async;
				task job @Async @Singleton;
				state cache @Singleton;
				start -> waiting -> job -> cache;
				""", false);

		ValidationReport report = new MachineValidator().validate(machine);

		assertThat(codes(report, "ABSTRACT_NOT_ON_INIT")).singleElement()
				.satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.ERROR));
		assertThat(codes(report, "ASYNC_REQUIRES_TASK")).extracting(Diagnostic::nodePath).containsExactly("waiting");
		assertThat(codes(report, "SINGLETON_REQUIRES_TASK_OR_CONTEXT")).extracting(Diagnostic::nodePath)
				.containsExactly("cache");
	}

	@Test
	void checksAttributeTypes() {
		Machine machine = compile("""
				task job {
				    retries<integer>: 2.5;
				    name<string>: "ok";
				    enabled<boolean>: "yes";
				    tags<Array<number>>: [1, "two"];
				    later<number>: "{{ settings.value }}";
				}
				""", false);

		List<Diagnostic> mismatches = codes(new MachineValidator(ValidationOptions.builder().inferDependencies(false).build())
				.validate(machine), "TYPE_MISMATCH");

		assertThat(mismatches).hasSize(3);
		assertThat(mismatches).extracting(Diagnostic::message).anySatisfy(m -> assertThat(m).contains("'retries'"))
				.anySatisfy(m -> assertThat(m).contains("'enabled'"))
				.anySatisfy(m -> assertThat(m).contains("element"));
	}

	@Test
	void checksMultiplicities() {
		Machine machine = compile("""
				init start;
				task a; task b; task c; task d; task e;
				start -> a;
				a "1" -> "0..*" b;
				a "x" -> c;
				a -> "5..2" d;
				a "2..2" -> e;
				b "1" => c;
				""", false);

		ValidationReport report = new MachineValidator().validate(machine);

		assertThat(codes(report, "INVALID_MULTIPLICITY")).hasSize(1);
		assertThat(codes(report, "MULTIPLICITY_RANGE")).hasSize(1);
		assertThat(codes(report, "UNUSUAL_MULTIPLICITY")).hasSize(1);
		assertThat(codes(report, "MULTIPLICITY_NOT_APPLICABLE")).hasSize(1);
	}

	@Test
	void multiplicityBoundsBeyondLongRangeAreCompared() {
		Machine machine = compile("""
				init start;
				task a; task b; task c;
				start -> a;
				a "1..99999999999999999999" -> b;
				a -> "99999999999999999999..1" c;
				""", false);

		ValidationReport report = new MachineValidator().validate(machine);

		assertThat(codes(report, "INVALID_MULTIPLICITY")).isEmpty();
		assertThat(codes(report, "MULTIPLICITY_RANGE")).singleElement()
				.satisfies(d -> assertThat(d.message()).contains("99999999999999999999"));
	}

	@Test
	void infersDependenciesFromGuards() {
		Machine machine = compile("""
				init start;
				context settings { limit: 3; }
				task a;
				start -when: "settings.limit > 1"-> a;
				""");

		ValidationReport report = new MachineValidator().validate(machine);

		assertThat(report.dependencies()).singleElement().satisfies(dependency -> {
			assertThat(machine.qualifiedName(dependency.source())).isEqualTo("start");
			assertThat(machine.qualifiedName(dependency.target())).isEqualTo("settings");
			assertThat(dependency.reason()).isEqualTo("condition references settings.limit");
		});
	}

	@Test
	void graphStatisticsCountEntriesExitsAndCycles() {
		Machine machine = compile("init start; state a; state b; start -> a -> b; b -> a;");

		GraphStatistics statistics = new GraphAnalyzer(machine).statistics();

		assertThat(statistics.nodeCount()).isEqualTo(3);
		assertThat(statistics.edgeCount()).isEqualTo(3);
		assertThat(statistics.entryPoints()).isEqualTo(1);
		assertThat(statistics.cycleCount()).isEqualTo(1);
	}

	private static Machine compile(String source) {
		return compile(source, true);
	}

	private static Machine compile(String source, boolean requireNoErrors) {
		CompilationResult result = new MachineCompiler(DygramConfig.defaults()).compile(source);
		assertThat(result.machine()).isNotNull();
		if (requireNoErrors) {
			assertThat(result.errors()).isEmpty();
		}
		return result.machine();
	}

	private static List<Diagnostic> codes(ValidationReport report, String code) {
		return report.diagnostics().stream().filter(d -> d.code().equals(code)).toList();
	}
}
