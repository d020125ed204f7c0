/*
 * どこで: Mmlogic API
 * 何を: profile 未検出を表現する
 * なぜ: GetProfile の 404 応答へ変換するため
 */
package com.example.mmlogic.api;

public class ProfileNotFoundException extends RuntimeException {
  public ProfileNotFoundException(String profileId) {
    super("profile not found: " + profileId);
  }
}
