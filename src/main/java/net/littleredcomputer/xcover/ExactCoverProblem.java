// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.io.Reader;
import java.io.StreamTokenizer;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An exact cover problem whose items have names, in the input language Knuth
 * uses for DLX1. Options are kept in an {@link ExactCoverMatrix}; this class
 * translates names to item indices and solutions back to names.
 */
public class ExactCoverProblem {
    private final ImmutableList<String> items;
    private final ImmutableMap<String, Integer> itemIndex;  // inverse of above mapping
    private final ExactCoverMatrix matrix;

    private ExactCoverProblem(List<String> primaryItems, List<String> secondaryItems) {
        if (primaryItems.isEmpty()) throw new InvalidInputException("there must be at least one primary item");
        ImmutableList<String> is = ImmutableList.<String>builder().addAll(primaryItems).addAll(secondaryItems).build();
        ImmutableMap.Builder<String, Integer> mb = ImmutableMap.builder();
        Set<String> itemsSeen = new HashSet<>();
        for (int i = 0; i < is.size(); ++i) {
            if (!itemsSeen.add(is.get(i))) throw new InvalidInputException("duplicate item: " + is.get(i));
            mb.put(is.get(i), i);
        }
        items = is;
        itemIndex = mb.build();
        matrix = ExactCoverMatrix.build(primaryItems.size(), secondaryItems.size());
    }

    /**
     * @param primaryItems names of the items to be covered exactly once
     * @param secondaryItems names of the items to be covered at most once
     * @throws InvalidInputException if there are no primary items or a name is repeated
     */
    public static ExactCoverProblem withItems(List<String> primaryItems, List<String> secondaryItems) {
        return new ExactCoverProblem(primaryItems, secondaryItems);
    }

    /**
     * Add an option naming a nonempty set of established items.
     * @param items sequence of item names
     * @return the row id of the option
     * @throws InvalidInputException if the option is empty, or names an item
     * that is unknown or repeated
     */
    public int addOption(Iterable<String> items) {
        Set<Integer> itemsSeen = new HashSet<>();
        List<Integer> itemsOfOption = new ArrayList<>();
        for (String item : items) {
            Integer ix = itemIndex.get(item);
            if (ix == null) throw new InvalidInputException("unknown item: " + item);
            if (!itemsSeen.add(ix)) throw new InvalidInputException("item repeated in option: " + item);
            itemsOfOption.add(ix);
        }
        return matrix.addOption(itemsOfOption);
    }

    public ExactCoverMatrix matrix() {
        return matrix;
    }

    public List<String> items() {
        return items;
    }

    public Optional<List<Integer>> solve() {
        return matrix.solve();
    }

    /** @see ExactCoverMatrix#solutions() */
    public Stream<List<Integer>> solutions() {
        return matrix.solutions();
    }

    /** @return for each option of a solution, the names of its items */
    public List<List<String>> optionsToItems(List<Integer> options) {
        return options.stream().map(o ->
                matrix.option(o).stream().map(items::get).collect(Collectors.toList())).collect(Collectors.toList());
    }

    public static ExactCoverProblem parseFrom(String problemDescription) {
        return parseFrom(new StringReader(problemDescription));
    }

    /**
     * Produces a StreamTokenizer adapted to the input language for XC problems:
     * any run of printable characters other than ; is a word.
     * @param r the input which the returned tokenizer will consume
     * @return the new StreamTokenizer instance
     */
    private static StreamTokenizer tokenizer(Reader r) {
        StreamTokenizer t = new StreamTokenizer(r);
        t.resetSyntax();
        t.wordChars('!', '~');
        t.wordChars(0xa1, 0xff);
        t.whitespaceChars(0, ' ');
        t.ordinaryChar(';');
        t.eolIsSignificant(true);
        return t;
    }

    /**
     * Parses a complete problem description. The format accepted is that described by Knuth
     * (first line: item names separated by whitespace; each subsequent nonblank
     * line is one option, containing a subset of items). The first line
     * may contain one semicolon which separates primary from secondary
     * items.
     * @param problemDescription textual description of XC problem
     * @return a problem instance from which solutions may be generated
     * @throws InvalidInputException if the description is malformed or cannot be read
     */
    public static ExactCoverProblem parseFrom(Reader problemDescription) {
        StreamTokenizer tz = tokenizer(problemDescription);
        List<String> primary = new ArrayList<>();
        List<String> secondary = null;
        int token;
        try {
            while ((token = tz.nextToken()) != StreamTokenizer.TT_EOL) {
                if (token == StreamTokenizer.TT_EOF) {
                    if (primary.isEmpty() && secondary == null) throw new InvalidInputException("no item line");
                    break;
                }
                if (token == ';') {
                    // The ; switches us from recording primary to secondary items.
                    if (primary.isEmpty()) throw new InvalidInputException("there must be at least one primary item");
                    if (secondary != null) throw new InvalidInputException("tertiary items are not supported");
                    secondary = new ArrayList<>();
                } else if (token == StreamTokenizer.TT_WORD) {
                    (secondary == null ? primary : secondary).add(tz.sval);
                } else {
                    throw new InvalidInputException("unexpected token " + tz);
                }
            }
            ExactCoverProblem p = new ExactCoverProblem(primary, secondary == null ? ImmutableList.of() : secondary);
            List<String> option = new ArrayList<>();
            while (token != StreamTokenizer.TT_EOF) {
                option.clear();
                while ((token = tz.nextToken()) == StreamTokenizer.TT_WORD) {
                    option.add(tz.sval);
                }
                if (token != StreamTokenizer.TT_EOL && token != StreamTokenizer.TT_EOF) {
                    throw new InvalidInputException("bad token: " + tz);
                }
                if (!option.isEmpty()) p.addOption(option);
            }
            return p;
        } catch (IOException e) {
            throw new InvalidInputException("cannot read problem description", e);
        }
    }
}
