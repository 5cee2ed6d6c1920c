package in.fxsignal.domain.model;

/**
 * Averaged composite strength score for one currency.
 *
 * @param currency      scored currency
 * @param score         mean of all contributions (base: +score, quote: -score)
 * @param contributions number of pair contributions averaged
 */
public record StrengthScore(Currency currency, double score, int contributions) {
}
