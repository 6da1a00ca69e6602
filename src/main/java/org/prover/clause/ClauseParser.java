package org.prover.clause;

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.prover.antlr.ClauseTextBaseVisitor;
import org.prover.antlr.ClauseTextLexer;
import org.prover.antlr.ClauseTextParser;
import org.prover.antlr.ClauseTextParser.ArgumentContext;
import org.prover.antlr.ClauseTextParser.ArgumentListContext;
import org.prover.antlr.ClauseTextParser.PredicateApplicationContext;
import org.prover.support.Clause;
import org.prover.support.Literal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * PARSER CLAUSOLE - Conversione da testo a strutture Clause/Literal
 *
 * Trasforma il testo delle clausole nel modello {@link Clause}. La disgiunzione e la
 * negazione sono gestite direttamente sul testo, mentre l'applicazione di predicato
 * Nome(arg1, arg2, ...) è riconosciuta dalla grammatica ANTLR ClauseText.
 *
 * FORMATO ACCETTATO:
 * - Clausola: letterali separati da ∨ (spazi opzionali attorno al simbolo)
 * - Letterale: [¬]Nome(arg, arg, ...) oppure [¬]Nome
 * - Argomenti: testo libero separato da virgole, spazi rimossi ai bordi
 *
 * DEGRADO CONTROLLATO:
 * Il parser non fallisce mai. Testo non riconosciuto (identificatore senza parentesi,
 * parentesi non bilanciate, frasi libere) diventa un letterale nullario il cui nome
 * è il testo ripulito dalla negazione.
 */
public final class ClauseParser {

    private static final Logger LOGGER = Logger.getLogger(ClauseParser.class.getName());

    /** Separatore di disgiunzione con spazi opzionali */
    private static final Pattern DISJUNCTION_SPLITTER = Pattern.compile("\\s*" + Clause.DISJUNCTION + "\\s*");

    /**
     * Previene istanziazione - classe utility
     */
    private ClauseParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PARSING CLAUSOLE

    /**
     * Converte il testo di una clausola nella struttura {@link Clause}.
     *
     * @param text clausola testuale, es. "¬Human(x) ∨ Mortal(x)"
     * @return clausola con i letterali nell'ordine del testo
     */
    public static Clause parseClause(String text) {
        String cleaned = text == null ? "" : text.trim();

        List<Literal> literals = new ArrayList<>();
        for (String segment : DISJUNCTION_SPLITTER.split(cleaned, -1)) {
            literals.add(parseLiteral(segment));
        }

        Clause clause = new Clause(literals);
        LOGGER.finest("Clausola analizzata: " + clause.render());
        return clause;
    }

    /**
     * Converte una sequenza di testi in clausole, preservandone l'ordine.
     */
    public static List<Clause> parseClauses(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return Collections.emptyList();
        }

        List<Clause> clauses = new ArrayList<>(texts.size());
        for (String text : texts) {
            clauses.add(parseClause(text));
        }
        return clauses;
    }

    //endregion

    //region PARSING LETTERALI

    /**
     * Converte il testo di un letterale nella struttura {@link Literal}.
     *
     * PROCESSO:
     * 1. Rimozione spazi e di tutti i simboli ¬ iniziali (negato se almeno uno)
     * 2. Riconoscimento del prefisso Nome(argomenti) tramite grammatica ANTLR
     * 3. Fallback su letterale nullario con il testo ripulito come nome
     *
     * @param text letterale testuale, es. "¬Mortal(socrates)"
     * @return letterale corrispondente, mai null
     */
    public static Literal parseLiteral(String text) {
        String trimmed = text == null ? "" : text.trim();
        boolean negated = trimmed.startsWith(Literal.NEGATION);

        String body = stripLeadingNegations(trimmed).trim();

        Literal parsed = parsePredicateApplication(negated, body);
        if (parsed != null) {
            return parsed;
        }

        LOGGER.fine("Letterale non strutturato, trattato come atomo nullario: '" + body + "'");
        return Literal.atom(negated, body);
    }

    private static String stripLeadingNegations(String text) {
        int start = 0;
        while (text.startsWith(Literal.NEGATION, start)) {
            start += Literal.NEGATION.length();
        }
        return text.substring(start);
    }

    /**
     * Esegue la pipeline ANTLR sul corpo del letterale.
     *
     * @return letterale riconosciuto oppure null se il testo non ha la forma Nome(...)
     */
    private static Literal parsePredicateApplication(boolean negated, String body) {
        if (body.isEmpty()) {
            return null;
        }

        ClauseTextLexer lexer = new ClauseTextLexer(CharStreams.fromString(body));
        lexer.removeErrorListeners();

        ClauseTextParser parser = new ClauseTextParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());

        try {
            PredicateApplicationContext tree = parser.predicateApplication();
            return new LiteralBuilder(negated).visit(tree);
        } catch (ParseCancellationException e) {
            return null;
        }
    }

    //endregion

    //region LISTE DI FORMULE

    /**
     * Divide un elenco di clausole separate da virgole, come prodotto dal formalizzatore.
     *
     * Le virgole interne alle parentesi appartengono agli argomenti e non dividono:
     * "Loves(x, y), ¬Loves(a, b)" produce due clausole. Segmenti vuoti sono scartati.
     *
     * @param text elenco testuale di clausole
     * @return clausole testuali nell'ordine originale
     */
    public static List<String> splitFormulaList(String text) {
        List<String> formulas = new ArrayList<>();
        if (text == null) {
            return formulas;
        }

        StringBuilder current = new StringBuilder();
        int depth = 0;

        for (char symbol : text.toCharArray()) {
            if (symbol == '(') {
                depth++;
            } else if (symbol == ')' && depth > 0) {
                depth--;
            } else if (symbol == ',' && depth == 0) {
                addIfNotBlank(formulas, current);
                current.setLength(0);
                continue;
            }
            current.append(symbol);
        }
        addIfNotBlank(formulas, current);

        return formulas;
    }

    private static void addIfNotBlank(List<String> formulas, StringBuilder segment) {
        String formula = segment.toString().trim();
        if (!formula.isEmpty()) {
            formulas.add(formula);
        }
    }

    //endregion

    //region VISITOR ANTLR

    /**
     * Visitor che costruisce il letterale dall'albero Nome(argomenti).
     * La polarità è già stata determinata sul testo.
     */
    private static final class LiteralBuilder extends ClauseTextBaseVisitor<Literal> {

        private final boolean negated;

        LiteralBuilder(boolean negated) {
            this.negated = negated;
        }

        @Override
        public Literal visitPredicateApplication(PredicateApplicationContext ctx) {
            String predicate = ctx.IDENTIFIER().getText();
            List<String> arguments = collectArguments(ctx.argumentList());
            return new Literal(negated, predicate, arguments);
        }

        /**
         * Nome() produce zero argomenti; ogni altro contenuto produce un argomento
         * per segmento tra virgole, anche se vuoto.
         */
        private List<String> collectArguments(ArgumentListContext ctx) {
            List<String> arguments = new ArrayList<>();
            if (ctx.getText().isEmpty()) {
                return arguments;
            }

            for (ArgumentContext argument : ctx.argument()) {
                arguments.add(argument.getText().trim());
            }
            return arguments;
        }
    }

    //endregion
}
