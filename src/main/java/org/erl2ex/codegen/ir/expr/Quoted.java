package org.erl2ex.codegen.ir.expr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Quoted form of an Elixir expression, as handed over by the converter. The
 * shape follows the target language's own quoted representation: literals,
 * lists, tuples, variables and three-part calls {@code (target, meta, args)}.
 * <p>
 * Values are immutable. Metadata maps are opaque to everything except the
 * unparser, which reads {@link #CHAR_META} on character-literal placeholders.
 */
public sealed interface Quoted permits Quoted.Atom, Quoted.Int, Quoted.Flt, Quoted.Str, Quoted.ListOf, Quoted.Tuple, Quoted.Var, Quoted.Call {

	/** Metadata key carrying the raw code point of a character literal placeholder. */
	String CHAR_META = "char";

	/** Variable name the converter uses for character literal placeholders. */
	String CHAR_PLACEHOLDER = "?";

	/**
	 * An atom. {@code nil}, {@code true} and {@code false} are atoms as well.
	 * @param name The atom text without the leading colon.
	 */
	record Atom(String name) implements Quoted {}

	/**
	 * An integer literal of arbitrary size.
	 * @param value The integer value.
	 */
	record Int(BigInteger value) implements Quoted {}

	/**
	 * A float literal.
	 * @param value The float value.
	 */
	record Flt(double value) implements Quoted {}

	/**
	 * A binary string literal.
	 * @param value The string contents, unescaped.
	 */
	record Str(String value) implements Quoted {}

	/**
	 * A list literal. Keyword lists are lists of two-element tuples keyed by atoms.
	 * @param elements The list elements.
	 */
	record ListOf(List<Quoted> elements) implements Quoted {
		public ListOf {
			elements = List.copyOf(elements);
		}
	}

	/**
	 * A tuple literal of any arity.
	 * @param elements The tuple elements.
	 */
	record Tuple(List<Quoted> elements) implements Quoted {
		public Tuple {
			elements = List.copyOf(elements);
		}
	}

	/**
	 * A variable reference.
	 * @param name The variable name.
	 * @param meta Node metadata.
	 */
	record Var(String name, Map<String, Object> meta) implements Quoted {
		public Var {
			meta = Map.copyOf(meta);
		}
	}

	/**
	 * A call node. Operators, special forms ({@code __block__}, {@code fn},
	 * {@code %{}}, ...) and remote calls (target is a {@code .} call) all use
	 * this shape.
	 * @param target The call target, an {@link Atom} for local calls and operators.
	 * @param meta Node metadata.
	 * @param args The call arguments.
	 */
	record Call(Quoted target, Map<String, Object> meta, List<Quoted> args) implements Quoted {
		public Call {
			meta = Map.copyOf(meta);
			args = List.copyOf(args);
		}

		/**
		 * @return The target name if the target is an atom, otherwise {@code null}.
		 */
		public String targetName() {
			return target instanceof Atom a ? a.name() : null;
		}
	}

	static Atom atom(String name) {
		return new Atom(name);
	}

	static Atom nil() {
		return new Atom("nil");
	}

	static Int integer(long value) {
		return new Int(BigInteger.valueOf(value));
	}

	static Flt flt(double value) {
		return new Flt(value);
	}

	static Str string(String value) {
		return new Str(value);
	}

	static ListOf list(Quoted... elements) {
		return new ListOf(Arrays.asList(elements));
	}

	static ListOf list(List<? extends Quoted> elements) {
		return new ListOf(new ArrayList<>(elements));
	}

	static Tuple tuple(Quoted... elements) {
		return new Tuple(Arrays.asList(elements));
	}

	/**
	 * Builds one keyword list entry, a two-element tuple keyed by an atom.
	 */
	static Tuple keyword(String key, Quoted value) {
		return tuple(atom(key), value);
	}

	static Var var(String name) {
		return new Var(name, Map.of());
	}

	/**
	 * Builds the placeholder node the converter emits for character literals.
	 * @param codePoint The literal's code point.
	 * @return The placeholder variable.
	 */
	static Var charLiteral(int codePoint) {
		return new Var(CHAR_PLACEHOLDER, Map.of(CHAR_META, codePoint));
	}

	/**
	 * Builds a local call, operator application or special form.
	 */
	static Call call(String name, Quoted... args) {
		return new Call(atom(name), Map.of(), Arrays.asList(args));
	}

	static Call call(String name, List<? extends Quoted> args) {
		return new Call(atom(name), Map.of(), new ArrayList<>(args));
	}

	/**
	 * Builds a remote call {@code module.function(args)}.
	 */
	static Call remote(Quoted module, String function, Quoted... args) {
		return new Call(call(".", module, atom(function)), Map.of(), Arrays.asList(args));
	}

	/**
	 * Builds an alias such as {@code Enum} or {@code Foo.Bar}.
	 */
	static Call alias(String... segments) {
		List<Quoted> parts = new ArrayList<>();
		for (String segment : segments) {
			parts.add(atom(segment));
		}
		return call("__aliases__", parts);
	}

	static Call block(Quoted... exprs) {
		return call("__block__", exprs);
	}

	/**
	 * Builds a single {@code ->} clause.
	 */
	static Call clause(List<? extends Quoted> params, Quoted body) {
		return call("->", list(params), body);
	}
}
