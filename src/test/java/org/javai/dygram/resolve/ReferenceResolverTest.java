package org.javai.dygram.resolve;

import static org.assertj.core.api.Assertions.assertThat;
import org.javai.dygram.build.MachineCompiler;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.Severity;
import org.javai.dygram.model.Machine;
import org.junit.jupiter.api.Test;

class ReferenceResolverTest {

	private final Machine machine = new MachineCompiler().compile("""
			init start;
			state review;
			Desk { state review; }
			Api {
			    Auth { state login; }
			    state login;
			}
			Billing { state invoice; }
			Shop { state invoice; }
			Outer {
			    Inner { state audit; }
			}
			Archive { state audit; }
			""").machine();

	private final ReferenceResolver resolver = new ReferenceResolver(machine);

	@Test
	void qualifiedPathResolvesExactly() {
		assertThat(pathOf(resolver.resolve("Billing.invoice"))).isEqualTo("Billing.invoice");
	}

	@Test
	void uniqueSuffixResolvesFromAnywhere() {
		assertThat(pathOf(resolver.resolve("Auth.login"))).isEqualTo("Api.Auth.login");
		assertThat(pathOf(resolver.resolve("start", "Billing"))).isEqualTo("start");
	}

	@Test
	void declaringScopeIsSearchedFirst() {
		assertThat(pathOf(resolver.resolve("invoice", "Shop"))).isEqualTo("Shop.invoice");
		assertThat(pathOf(resolver.resolve("login", "Api"))).isEqualTo("Api.login");
		assertThat(pathOf(resolver.resolve("login", "Api.Auth"))).isEqualTo("Api.Auth.login");
	}

	@Test
	void exactRootPathIsCheckedBeforeTheDeclaringScope() {
		assertThat(pathOf(resolver.resolve("review", "Desk"))).isEqualTo("review");
		assertThat(pathOf(resolver.resolve("Desk.review", "Desk"))).isEqualTo("Desk.review");
	}

	@Test
	void enclosingScopeNarrowsSuffixMatches() {
		assertThat(pathOf(resolver.resolve("audit", "Outer"))).isEqualTo("Outer.Inner.audit");
	}

	@Test
	void sameNameInSiblingScopesIsAmbiguous() {
		Resolution resolution = resolver.resolve("invoice");

		assertThat(resolution).isInstanceOf(Resolution.Ambiguous.class);
		assertThat(((Resolution.Ambiguous) resolution).candidates()).containsExactly("Billing.invoice", "Shop.invoice");

		Diagnostic diagnostic = ReferenceResolver.toDiagnostic(resolution, "Edge start -> invoice");
		assertThat(diagnostic.code()).isEqualTo("AMBIGUOUS_REFERENCE");
		assertThat(diagnostic.severity()).isEqualTo(Severity.ERROR);
		assertThat(diagnostic.related()).containsExactly("Billing.invoice", "Shop.invoice");
		assertThat(diagnostic.message()).contains("qualify the name");
	}

	@Test
	void unknownNameIsUnresolved() {
		Resolution resolution = resolver.resolve("shipping");

		assertThat(resolution.isResolved()).isFalse();
		Diagnostic diagnostic = ReferenceResolver.toDiagnostic(resolution, "Edge start -> shipping");
		assertThat(diagnostic.code()).isEqualTo("UNRESOLVED_REFERENCE");
		assertThat(diagnostic.message()).isEqualTo("Edge start -> shipping refers to undefined node 'shipping'");
	}

	@Test
	void partialSegmentIsNotASuffixMatch() {
		assertThat(resolver.resolve("nvoice")).isInstanceOf(Resolution.Unresolved.class);
	}

	private String pathOf(Resolution resolution) {
		assertThat(resolution).isInstanceOf(Resolution.Resolved.class);
		return machine.qualifiedName(((Resolution.Resolved) resolution).node());
	}
}
