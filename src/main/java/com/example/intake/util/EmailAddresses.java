package com.example.intake.util;

import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

@UtilityClass
public class EmailAddresses {

  // something@something.something, no whitespace
  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

  public static boolean isValid(String email) {
    return email != null && EMAIL.matcher(email).matches();
  }
}
