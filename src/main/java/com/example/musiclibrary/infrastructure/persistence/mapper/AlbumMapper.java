package com.example.musiclibrary.infrastructure.persistence.mapper;

import com.example.musiclibrary.infrastructure.persistence.entity.AlbumEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface AlbumMapper {

    @Insert("INSERT INTO album(title, artist_name, primary_artist_name, `year`) "
            + "VALUES(#{title}, #{artistName}, #{primaryArtistName}, #{year})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(AlbumEntity entity);

    @Select("SELECT id, title, artist_name, primary_artist_name, `year`, created_at, updated_at "
            + "FROM album WHERE title = #{title} AND artist_name = #{artistName} ORDER BY id LIMIT 1")
    AlbumEntity selectByTitleAndArtistName(@Param("title") String title, @Param("artistName") String artistName);

    @Select("SELECT id, title, artist_name, primary_artist_name, `year`, created_at, updated_at "
            + "FROM album WHERE id = #{id}")
    AlbumEntity selectById(@Param("id") Long id);

    @Select("SELECT a.id FROM album a WHERE NOT EXISTS (SELECT 1 FROM song s WHERE s.album_id = a.id)")
    List<Long> selectOrphanIds();

    @Update("UPDATE album SET artist_name = #{artistName}, primary_artist_name = #{primaryArtistName}, "
            + "updated_at = NOW() WHERE id = #{id}")
    int updateArtistNames(@Param("id") Long id,
                          @Param("artistName") String artistName,
                          @Param("primaryArtistName") String primaryArtistName);

    @Delete("<script>"
            + "DELETE FROM album WHERE id IN "
            + "<foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    int deleteByIds(@Param("ids") List<Long> ids);
}
