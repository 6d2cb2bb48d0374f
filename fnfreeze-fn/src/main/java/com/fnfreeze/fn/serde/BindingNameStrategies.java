package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.DispatchFn;
import com.fnfreeze.fn.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Factory class for the built-in binding name strategies.
 */
public final class BindingNameStrategies {
    private static final Pattern DISAMBIGUATION_SUFFIX = Pattern.compile("^(.+?)\\$\\d+(?:[A-Za-z_][A-Za-z0-9_]*)?$");
    private static final Pattern LAMBDA_SUFFIX = Pattern.compile("\\$\\$Lambda(?:\\$\\d+)?/.*$");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])|([A-Z])([A-Z][a-z])");
    
    private BindingNameStrategies() {
        // Prevent instantiation
    }
    
    /**
     * The default fallback chain: {@link #demangled()}, {@link #dispatchTable()},
     * {@link #disambiguated()}, {@link #synthetic()}.
     *
     * @return Strategies in resolution order
     */
    public static List<BindingNameStrategy> defaults() {
        return List.of(demangled(), dispatchTable(), disambiguated(), synthetic());
    }
    
    /**
     * Reverse javac's nested-class naming. {@code Owner$Square} proposes the
     * static fields {@code Owner.Square}, {@code Owner.SQUARE} and
     * {@code Owner.square}.
     *
     * @return Strategy
     */
    public static BindingNameStrategy demangled() {
        return (fn, bindings, loader) -> {
            String className = fn.getClass().getName();
            int split = className.lastIndexOf('$');
            if (split <= 0 || split == className.length() - 1) {
                return List.of();
            }
            String owner = className.substring(0, split);
            String member = className.substring(split + 1);
            if (!isIdentifier(member)) {
                return List.of();
            }
            List<Symbol> candidates = new ArrayList<>(3);
            for (String field : new String[]{member, constantCase(member), lowerCamelCase(member)}) {
                Symbol symbol = Symbol.of(owner, field);
                if (!candidates.contains(symbol)) {
                    candidates.add(symbol);
                }
            }
            return candidates;
        };
    }
    
    /**
     * Read the name a dispatch function records about itself.
     *
     * @return Strategy
     */
    public static BindingNameStrategy dispatchTable() {
        return (fn, bindings, loader) -> fn instanceof DispatchFn
                ? List.of(((DispatchFn) fn).methodImplCache().sym())
                : List.of();
    }
    
    /**
     * Strip javac's anonymous and local class suffixes ({@code Owner$1},
     * {@code Owner$Inner$2}, {@code Owner$1Local}) and scan the remaining owner
     * for a static field holding the instance.
     *
     * @return Strategy
     */
    public static BindingNameStrategy disambiguated() {
        return (fn, bindings, loader) -> {
            String className = fn.getClass().getName();
            String owner = stripDisambiguation(className);
            if (owner.equals(className)) {
                return List.of();
            }
            return bindings.findByValue(owner, fn, loader).map(List::of).orElse(List.of());
        };
    }
    
    /**
     * Strip the hidden-class suffix the runtime gives lambdas and method
     * references ({@code Owner$$Lambda$14/0x0000000800c03000}) and scan the
     * owner for a static field holding the instance.
     *
     * @return Strategy
     */
    public static BindingNameStrategy synthetic() {
        return (fn, bindings, loader) -> {
            String className = fn.getClass().getName();
            Matcher matcher = LAMBDA_SUFFIX.matcher(className);
            if (!matcher.find() || matcher.start() == 0) {
                return List.of();
            }
            String owner = className.substring(0, matcher.start());
            return bindings.findByValue(owner, fn, loader).map(List::of).orElse(List.of());
        };
    }
    
    static String stripDisambiguation(String className) {
        String current = className;
        Matcher matcher = DISAMBIGUATION_SUFFIX.matcher(current);
        while (matcher.matches()) {
            current = matcher.group(1);
            matcher = DISAMBIGUATION_SUFFIX.matcher(current);
        }
        return current;
    }
    
    static String constantCase(String member) {
        return CAMEL_BOUNDARY.matcher(member).replaceAll(match -> match.group(1) != null
                ? match.group(1) + "_" + match.group(2)
                : match.group(3) + "_" + match.group(4))
                .toUpperCase(Locale.ROOT);
    }
    
    static String lowerCamelCase(String member) {
        return Character.toLowerCase(member.charAt(0)) + member.substring(1);
    }
    
    private static boolean isIdentifier(String member) {
        if (!Character.isJavaIdentifierStart(member.charAt(0)) || member.charAt(0) == '$') {
            return false;
        }
        for (int i = 1; i < member.length(); i++) {
            if (!Character.isJavaIdentifierPart(member.charAt(i)) || member.charAt(i) == '$') {
                return false;
            }
        }
        return true;
    }
}
