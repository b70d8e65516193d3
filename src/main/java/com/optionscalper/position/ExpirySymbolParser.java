package com.optionscalper.position;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a contract's expiry date from its NFO trading symbol.
 *
 * <p>Two conventions are recognised:
 * <ul>
 *   <li>Monthly: {@code <UNDERLYING><YY><MON><STRIKE><CE|PE>}, e.g. {@code NIFTY24DEC24000CE}.
 *       The expiry is taken as the last calendar day of that month, which is never earlier than
 *       the real (last-Thursday style) expiry.</li>
 *   <li>Weekly: {@code <UNDERLYING><YY><M><DD><STRIKE><CE|PE>}, e.g. {@code NIFTY2411424000CE}, where
 *       {@code M} is 1-9 for January to September and O, N, D for October to December.</li>
 * </ul>
 *
 * <p>Anything else (including impossible dates) yields an empty result; callers must keep a
 * position whose expiry cannot be derived.
 */
public final class ExpirySymbolParser {

    private static final Logger log = LoggerFactory.getLogger(ExpirySymbolParser.class);

    private static final Pattern MONTHLY =
            Pattern.compile("^[A-Z&-]+(\\d{2})(JAN|FEB|MAR|APR|MAY|JUN|JUL|AUG|SEP|OCT|NOV|DEC)");

    private static final Pattern WEEKLY = Pattern.compile("^[A-Z&-]+(\\d{2})([1-9OND])(\\d{2})\\d");

    private static final Map<String, Month> MONTHS = Map.ofEntries(
            Map.entry("JAN", Month.JANUARY),
            Map.entry("FEB", Month.FEBRUARY),
            Map.entry("MAR", Month.MARCH),
            Map.entry("APR", Month.APRIL),
            Map.entry("MAY", Month.MAY),
            Map.entry("JUN", Month.JUNE),
            Map.entry("JUL", Month.JULY),
            Map.entry("AUG", Month.AUGUST),
            Map.entry("SEP", Month.SEPTEMBER),
            Map.entry("OCT", Month.OCTOBER),
            Map.entry("NOV", Month.NOVEMBER),
            Map.entry("DEC", Month.DECEMBER));

    private ExpirySymbolParser() {}

    public static Optional<LocalDate> parseExpiry(String tradingSymbol) {
        if (tradingSymbol == null || tradingSymbol.isBlank()) {
            return Optional.empty();
        }
        String symbol = tradingSymbol.toUpperCase();
        try {
            Matcher monthly = MONTHLY.matcher(symbol);
            if (monthly.find()) {
                int year = 2000 + Integer.parseInt(monthly.group(1));
                Month month = MONTHS.get(monthly.group(2));
                return Optional.of(YearMonth.of(year, month).atEndOfMonth());
            }

            Matcher weekly = WEEKLY.matcher(symbol);
            if (weekly.find()) {
                int year = 2000 + Integer.parseInt(weekly.group(1));
                int month = weeklyMonth(weekly.group(2).charAt(0));
                int day = Integer.parseInt(weekly.group(3));
                return Optional.of(LocalDate.of(year, month, day));
            }
        } catch (DateTimeException | NumberFormatException e) {
            log.debug("Could not derive expiry from {}: {}", tradingSymbol, e.getMessage());
            return Optional.empty();
        }

        log.debug("No expiry pattern matched for {}", tradingSymbol);
        return Optional.empty();
    }

    private static int weeklyMonth(char code) {
        return switch (code) {
            case 'O' -> 10;
            case 'N' -> 11;
            case 'D' -> 12;
            default -> code - '0';
        };
    }
}
