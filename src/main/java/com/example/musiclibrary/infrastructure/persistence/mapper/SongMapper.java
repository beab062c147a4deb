package com.example.musiclibrary.infrastructure.persistence.mapper;

import com.example.musiclibrary.infrastructure.persistence.entity.SongEntity;
import com.example.musiclibrary.infrastructure.persistence.model.SongFileStateRow;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SongMapper {

    @Insert("INSERT INTO song("
            + "folder_id, file_path, file_path_hash, directory_path, file_modified_date, title, artist_name, primary_artist_name, "
            + "album_id, track_no, disc_no, `year`, genre, duration_sec, bitrate, sample_rate, channels, cover_art_uri, light_swatch, "
            + "dark_swatch, lyrics, lrc_file_path, replay_gain_track_gain, replay_gain_track_peak, extraction_error"
            + ") VALUES ("
            + "#{folderId}, #{filePath}, #{filePathHash}, #{directoryPath}, #{fileModifiedDate}, #{title}, #{artistName}, "
            + "#{primaryArtistName}, #{albumId}, #{trackNo}, #{discNo}, #{year}, #{genre}, #{durationSec}, #{bitrate}, "
            + "#{sampleRate}, #{channels}, #{coverArtUri}, #{lightSwatch}, #{darkSwatch}, #{lyrics}, #{lrcFilePath}, "
            + "#{replayGainTrackGain}, #{replayGainTrackPeak}, #{extractionError})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SongEntity entity);

    /**
     * Replaces every scanned field of an existing row. Lyrics lookup state and the denormalized artist
     * names are left to their own update paths.
     */
    @Update("UPDATE song SET "
            + "folder_id = #{folderId}, "
            + "directory_path = #{directoryPath}, "
            + "file_modified_date = #{fileModifiedDate}, "
            + "title = #{title}, "
            + "album_id = #{albumId}, "
            + "track_no = #{trackNo}, "
            + "disc_no = #{discNo}, "
            + "`year` = #{year}, "
            + "genre = #{genre}, "
            + "duration_sec = #{durationSec}, "
            + "bitrate = #{bitrate}, "
            + "sample_rate = #{sampleRate}, "
            + "channels = #{channels}, "
            + "cover_art_uri = #{coverArtUri}, "
            + "light_swatch = #{lightSwatch}, "
            + "dark_swatch = #{darkSwatch}, "
            + "lyrics = #{lyrics}, "
            + "lrc_file_path = #{lrcFilePath}, "
            + "replay_gain_track_gain = #{replayGainTrackGain}, "
            + "replay_gain_track_peak = #{replayGainTrackPeak}, "
            + "extraction_error = #{extractionError}, "
            + "updated_at = NOW() "
            + "WHERE id = #{id}")
    int updateScannedFields(SongEntity entity);

    @Select("SELECT id, folder_id, file_path, file_path_hash, directory_path, file_modified_date, title, artist_name, primary_artist_name, "
            + "album_id, track_no, disc_no, `year`, genre, duration_sec, bitrate, sample_rate, channels, cover_art_uri, light_swatch, "
            + "dark_swatch, lyrics, lrc_file_path, lyrics_last_checked_utc, replay_gain_track_gain, replay_gain_track_peak, "
            + "extraction_error, created_at, updated_at "
            + "FROM song WHERE id = #{id}")
    SongEntity selectById(@Param("id") Long id);

    @Select("SELECT id, file_path, file_modified_date, cover_art_uri, lrc_file_path "
            + "FROM song WHERE folder_id = #{folderId}")
    List<SongFileStateRow> selectFileStatesByFolderId(@Param("folderId") Long folderId);

    @Select("<script>"
            + "SELECT id, file_path, file_modified_date, cover_art_uri, lrc_file_path FROM song WHERE id IN "
            + "<foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    List<SongFileStateRow> selectFileStatesByIds(@Param("ids") List<Long> ids);

    @Update("UPDATE song SET artist_name = #{artistName}, primary_artist_name = #{primaryArtistName}, "
            + "updated_at = NOW() WHERE id = #{id}")
    int updateArtistNames(@Param("id") Long id,
                          @Param("artistName") String artistName,
                          @Param("primaryArtistName") String primaryArtistName);

    @Update("UPDATE song SET lrc_file_path = #{lrcFilePath}, lyrics_last_checked_utc = #{lyricsLastCheckedUtc}, "
            + "updated_at = NOW() WHERE id = #{id}")
    int updateLyricsState(@Param("id") Long id,
                          @Param("lrcFilePath") String lrcFilePath,
                          @Param("lyricsLastCheckedUtc") LocalDateTime lyricsLastCheckedUtc);

    @Select("SELECT COUNT(1) FROM song WHERE cover_art_uri = #{coverArtUri}")
    int countByCoverArtUri(@Param("coverArtUri") String coverArtUri);

    @Select("SELECT s.file_path FROM song s JOIN song_artist sa ON sa.song_id = s.id "
            + "WHERE sa.artist_id = #{artistId} ORDER BY s.id LIMIT 1")
    String selectSampleFilePathByArtistId(@Param("artistId") Long artistId);

    @Delete("<script>"
            + "DELETE FROM song WHERE id IN "
            + "<foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    int deleteByIds(@Param("ids") List<Long> ids);

    @Delete("DELETE FROM song WHERE folder_id = #{folderId}")
    int deleteByFolderId(@Param("folderId") Long folderId);
}
