package com.example.mmlogic.repository;

import com.example.mmlogic.model.ProfileRecord;
import java.util.Optional;

public interface ProfileRepository {

  /** 役割: profile hash を読む。 動作: hash が存在しなければ empty を返す。 */
  Optional<ProfileRecord> findById(String profileId);
}
