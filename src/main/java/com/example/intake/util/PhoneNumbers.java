package com.example.intake.util;

import com.example.intake.exception.InvalidInputException;
import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * E.164 normalization for phone numbers typed by users. US numbers may be entered without
 * a country code.
 */
@UtilityClass
public class PhoneNumbers {

  private static final Pattern NOT_DIGIT_OR_PLUS = Pattern.compile("[^\\d+]");
  private static final Pattern INTERNATIONAL = Pattern.compile("^\\+\\d{7,15}$");

  /**
   * Normalizes a phone number to E.164.
   * <ul>
   *   <li>everything except digits and {@code +} is stripped</li>
   *   <li>a leading {@code +} must be followed by 7 to 15 digits</li>
   *   <li>10 digits are taken as a US number and get {@code +1}</li>
   *   <li>11 digits starting with {@code 1} get {@code +}</li>
   * </ul>
   *
   * @param input raw user input
   * @return the E.164 number
   * @throws InvalidInputException if the input cannot be normalized
   */
  public static String toE164(String input) {
    if (input == null) {
      throw new InvalidInputException("Invalid phone");
    }

    String stripped = NOT_DIGIT_OR_PLUS.matcher(input).replaceAll("");
    if (stripped.startsWith("+")) {
      if (INTERNATIONAL.matcher(stripped).matches()) {
        return stripped;
      }
      throw new InvalidInputException("Invalid phone");
    }

    String digits = stripped.replace("+", "");
    if (digits.length() == 10) {
      return "+1" + digits;
    }
    if (digits.length() == 11 && digits.startsWith("1")) {
      return "+" + digits;
    }
    throw new InvalidInputException("Invalid phone");
  }

  public static boolean isE164(String value) {
    return value != null && INTERNATIONAL.matcher(value).matches();
  }
}
