package ca.gc.cra.vigil.application.finance;

import static java.util.Map.entry;

import java.util.Map;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> IBAN length per country (ISO 13616 registry subset, 77 countries).
 * <p><strong>Thread-safety:</strong> Backed by an unmodifiable map; safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public final class IbanRegistry {
  private static final Map<String, Integer> LENGTHS = Map.ofEntries(
      entry("AD", 24), entry("AE", 23), entry("AL", 28), entry("AT", 20), entry("AZ", 28), entry("BA", 20), entry("BE", 16),
      entry("BG", 22), entry("BH", 22), entry("BR", 29), entry("BY", 28), entry("CH", 21), entry("CR", 22), entry("CY", 28),
      entry("CZ", 24), entry("DE", 22), entry("DK", 18), entry("DO", 28), entry("EE", 20), entry("EG", 29), entry("ES", 24),
      entry("FI", 18), entry("FO", 18), entry("FR", 27), entry("GB", 22), entry("GE", 22), entry("GI", 23), entry("GL", 18),
      entry("GR", 27), entry("GT", 28), entry("HR", 21), entry("HU", 28), entry("IE", 22), entry("IL", 23), entry("IQ", 23),
      entry("IS", 26), entry("IT", 27), entry("JO", 30), entry("KW", 30), entry("KZ", 20), entry("LB", 28), entry("LC", 32),
      entry("LI", 21), entry("LT", 20), entry("LU", 20), entry("LV", 21), entry("MC", 27), entry("MD", 24), entry("ME", 22),
      entry("MK", 19), entry("MR", 27), entry("MT", 31), entry("MU", 30), entry("NL", 18), entry("NO", 15), entry("PK", 24),
      entry("PL", 28), entry("PS", 29), entry("PT", 25), entry("QA", 29), entry("RO", 24), entry("RS", 22), entry("SA", 24),
      entry("SC", 31), entry("SE", 24), entry("SI", 19), entry("SK", 24), entry("SM", 27), entry("ST", 25), entry("SV", 28),
      entry("TL", 23), entry("TN", 24), entry("TR", 26), entry("UA", 29), entry("VA", 22), entry("VG", 24), entry("XK", 20));

  private IbanRegistry() {
    // Utility
  }

  /**
   * Looks up the IBAN length of a country.
   *
   * @param countryCode two-letter uppercase ISO 3166 code
   * @return expected total IBAN length, or empty when the country is not registered
   */
  public static OptionalInt expectedLength(String countryCode) {
    Integer length = countryCode == null ? null : LENGTHS.get(countryCode);
    return length == null ? OptionalInt.empty() : OptionalInt.of(length);
  }

  /**
   * Returns every registered country with its IBAN length.
   *
   * @return unmodifiable country to length map
   */
  public static Map<String, Integer> lengths() {
    return LENGTHS;
  }
}
