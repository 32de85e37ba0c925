package org.tetra.chroma.math.glyph;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static Unicode tables used by the renderer: script digits and letters, Greek letters and
 * named math symbols. All tables are immutable.
 */
public final class Glyphs {
    private Glyphs() {}

    private static final Map<Integer, String> SUPERSCRIPT = table(
        "0123456789+-=()nixyabcdefghjklmoprstuvwz",
        "⁰¹²³⁴⁵⁶⁷⁸⁹⁺⁻⁼⁽⁾ⁿⁱˣʸᵃᵇᶜᵈᵉᶠᵍʰʲᵏˡᵐᵒᵖʳˢᵗᵘᵛʷᶻ");

    // Mathematical bold digits stand in where the superscript forms are too small to read.
    private static final Map<Integer, String> SUPERSCRIPT_BOLD = table(
        "0123456789+-=()nix",
        "⁰¹𝟐𝟑𝟒𝟓𝟔𝟕𝟖𝟗⁺⁻⁼⁽⁾ⁿⁱˣ");

    private static final Map<Integer, String> SUBSCRIPT = table(
        "0123456789+-=()aehijklmnoprstuvx",
        "₀₁₂₃₄₅₆₇₈₉₊₋₌₍₎ₐₑₕᵢⱼₖₗₘₙₒₚᵣₛₜᵤᵥₓ");

    private static final Map<String, String> GREEK = pairs(
        "alpha", "α", "beta", "β", "gamma", "γ", "delta", "δ",
        "epsilon", "ε", "zeta", "ζ", "eta", "η", "theta", "θ",
        "iota", "ι", "kappa", "κ", "lambda", "λ", "mu", "μ",
        "nu", "ν", "xi", "ξ", "omicron", "ο", "pi", "π",
        "rho", "ρ", "sigma", "σ", "tau", "τ", "upsilon", "υ",
        "phi", "φ", "chi", "χ", "psi", "ψ", "omega", "ω",
        "Alpha", "Α", "Beta", "Β", "Gamma", "Γ", "Delta", "Δ",
        "Epsilon", "Ε", "Zeta", "Ζ", "Eta", "Η", "Theta", "Θ",
        "Iota", "Ι", "Kappa", "Κ", "Lambda", "Λ", "Mu", "Μ",
        "Nu", "Ν", "Xi", "Ξ", "Omicron", "Ο", "Pi", "Π",
        "Rho", "Ρ", "Sigma", "Σ", "Tau", "Τ", "Upsilon", "Υ",
        "Phi", "Φ", "Chi", "Χ", "Psi", "Ψ", "Omega", "Ω",
        "varepsilon", "ε", "varphi", "φ", "varpi", "ϖ", "varrho", "ϱ",
        "varsigma", "ς", "vartheta", "ϑ");

    private static final Map<String, String> SYMBOLS = pairs(
        "infty", "∞", "partial", "∂", "nabla", "∇", "forall", "∀",
        "exists", "∃", "nexists", "∄", "emptyset", "∅", "varnothing", "∅",
        "in", "∈", "notin", "∉", "ni", "∋", "subset", "⊂",
        "supset", "⊃", "subseteq", "⊆", "supseteq", "⊇",
        "cup", "∪", "cap", "∩", "setminus", "∖",
        "times", "×", "div", "÷", "cdot", "·", "ast", "∗",
        "star", "⋆", "circ", "∘", "bullet", "•",
        "pm", "±", "mp", "∓", "leq", "≤", "geq", "≥",
        "neq", "≠", "approx", "≈", "equiv", "≡", "sim", "∼",
        "propto", "∝", "ll", "≪", "gg", "≫",
        "to", "→", "gets", "←", "leftrightarrow", "↔",
        "Rightarrow", "⇒", "Leftarrow", "⇐", "Leftrightarrow", "⇔",
        "uparrow", "↑", "downarrow", "↓", "updownarrow", "↕",
        "Uparrow", "⇑", "Downarrow", "⇓",
        "implies", "⟹", "iff", "⟺",
        "neg", "¬", "land", "∧", "lor", "∨", "oplus", "⊕",
        "otimes", "⊗", "perp", "⊥", "angle", "∠",
        "prime", "′", "dprime", "″", "therefore", "∴", "because", "∵",
        "ldots", "…", "cdots", "⋯", "vdots", "⋮", "ddots", "⋱",
        "aleph", "ℵ", "hbar", "ℏ", "ell", "ℓ", "wp", "℘",
        "Re", "ℜ", "Im", "ℑ",
        "sqrt", "√", "cbrt", "∛", "fourthrt", "∜",
        "int", "∫", "iint", "∬", "iiint", "∭", "oint", "∮",
        "prod", "∏", "coprod", "∐",
        "langle", "⟨", "rangle", "⟩", "lceil", "⌈", "rceil", "⌉",
        "lfloor", "⌊", "rfloor", "⌋");

    /**
     * Superscript form of a single character, preferring the bold table.
     */
    public static Optional<String> superscript(int codePoint) {
        var bold = SUPERSCRIPT_BOLD.get(codePoint);
        if (bold != null) {
            return Optional.of(bold);
        }
        return Optional.ofNullable(SUPERSCRIPT.get(codePoint));
    }

    /**
     * Subscript form of a whole string, present only when every character has one.
     */
    public static Optional<String> subscript(String text) {
        var sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            var glyph = SUBSCRIPT.get(cp);
            if (glyph == null) {
                return Optional.empty();
            }
            sb.append(glyph);
            i += Character.charCount(cp);
        }
        return Optional.of(sb.toString());
    }

    /**
     * Glyph for a command name found in the Greek or symbol tables.
     */
    public static Optional<String> named(String command) {
        var greek = GREEK.get(command);
        if (greek != null) {
            return Optional.of(greek);
        }
        return Optional.ofNullable(SYMBOLS.get(command));
    }

    private static Map<Integer, String> table(String keys, String values) {
        var keyPoints = keys.codePoints().toArray();
        var valuePoints = values.codePoints().toArray();
        if (keyPoints.length != valuePoints.length) {
            throw new IllegalStateException("Glyph table mismatch: " + keys);
        }
        var map = new HashMap<Integer, String>();
        for (int i = 0; i < keyPoints.length; i++) {
            map.put(keyPoints[i], Character.toString(valuePoints[i]));
        }
        return Map.copyOf(map);
    }

    private static Map<String, String> pairs(String... keysAndValues) {
        var map = new HashMap<String, String>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            map.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return Map.copyOf(map);
    }
}
