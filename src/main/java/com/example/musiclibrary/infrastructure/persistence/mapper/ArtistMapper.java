package com.example.musiclibrary.infrastructure.persistence.mapper;

import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
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
public interface ArtistMapper {

    /**
     * Inserts the artist, or resolves the id of the existing row with the same name.
     */
    @Insert("INSERT INTO artist(name) VALUES(#{name}) "
            + "ON DUPLICATE KEY UPDATE id = LAST_INSERT_ID(id)")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insertOrGetId(ArtistEntity entity);

    @Select("SELECT id, name, biography, local_image_cache_path, metadata_last_checked_utc, created_at, updated_at "
            + "FROM artist WHERE id = #{id}")
    ArtistEntity selectById(@Param("id") Long id);

    @Select("SELECT id, name, biography, local_image_cache_path, metadata_last_checked_utc, created_at, updated_at "
            + "FROM artist WHERE metadata_last_checked_utc IS NULL AND id > #{afterId} ORDER BY id LIMIT #{limit}")
    List<ArtistEntity> selectPendingMetadata(@Param("afterId") long afterId, @Param("limit") int limit);

    @Select("SELECT ar.id, ar.name, ar.biography, ar.local_image_cache_path, ar.metadata_last_checked_utc, "
            + "ar.created_at, ar.updated_at FROM artist ar "
            + "WHERE NOT EXISTS (SELECT 1 FROM song_artist sa WHERE sa.artist_id = ar.id) "
            + "AND NOT EXISTS (SELECT 1 FROM album_artist aa WHERE aa.artist_id = ar.id)")
    List<ArtistEntity> selectOrphans();

    @Update("UPDATE artist SET local_image_cache_path = #{path}, updated_at = NOW() WHERE id = #{id}")
    int updateLocalImageCachePath(@Param("id") Long id, @Param("path") String path);

    @Update("UPDATE artist SET biography = IFNULL(#{biography}, biography), "
            + "metadata_last_checked_utc = #{checkedUtc}, updated_at = NOW() WHERE id = #{id}")
    int updateMetadataChecked(@Param("id") Long id,
                              @Param("biography") String biography,
                              @Param("checkedUtc") LocalDateTime checkedUtc);

    @Delete("<script>"
            + "DELETE FROM artist WHERE id IN "
            + "<foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    int deleteByIds(@Param("ids") List<Long> ids);
}
